package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record HavingClause(List<Constraint> conditions) implements SparqlNode {

	public HavingClause {
		conditions = Nodes.nonEmpty("HavingClause", conditions, "condition");
	}

	public static HavingClause of(Constraint... conditions) {
		return new HavingClause(List.of(conditions));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitHavingClause(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(conditions);
	}
}
