package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code SELECT [DISTINCT|REDUCED] items}. No items selects all
 * variables and renders {@code *}.
 */
public record SelectClause(SelectModifier modifier, List<SelectItem> items) implements SparqlNode {

	public SelectClause {
		items = Nodes.copy("SelectClause", items);
	}

	public static SelectClause all() {
		return new SelectClause(null, List.of());
	}

	public static SelectClause of(SelectItem... items) {
		return new SelectClause(null, List.of(items));
	}

	public static SelectClause distinct(SelectItem... items) {
		return new SelectClause(SelectModifier.DISTINCT, List.of(items));
	}

	public boolean selectsAll() {
		return items.isEmpty();
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitSelectClause(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(items);
	}
}
