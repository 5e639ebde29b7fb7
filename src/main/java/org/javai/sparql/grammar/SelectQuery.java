package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record SelectQuery(SelectClause select, List<DatasetClause> datasets, WhereClause where,
		SolutionModifier modifier) implements QueryForm {

	public SelectQuery {
		Nodes.require(select, "select");
		datasets = Nodes.copy("SelectQuery", datasets);
		Nodes.require(where, "where");
		modifier = modifier != null ? modifier : SolutionModifier.none();
	}

	public SelectQuery(SelectClause select, WhereClause where) {
		this(select, List.of(), where, SolutionModifier.none());
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitSelectQuery(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(select, datasets, where, modifier);
	}
}
