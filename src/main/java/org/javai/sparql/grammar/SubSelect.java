package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A SELECT nested inside a group graph pattern.
 */
public record SubSelect(SelectClause select, WhereClause where, SolutionModifier modifier, ValuesClause values)
		implements GroupGraphPatternContent {

	public SubSelect {
		Nodes.require(select, "select");
		Nodes.require(where, "where");
		modifier = modifier != null ? modifier : SolutionModifier.none();
	}

	public SubSelect(SelectClause select, WhereClause where) {
		this(select, where, SolutionModifier.none(), null);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitSubSelect(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(select, where, modifier, values);
	}
}
