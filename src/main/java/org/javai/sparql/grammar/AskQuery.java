package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record AskQuery(List<DatasetClause> datasets, WhereClause where, SolutionModifier modifier)
		implements QueryForm {

	public AskQuery {
		datasets = Nodes.copy("AskQuery", datasets);
		Nodes.require(where, "where");
		modifier = modifier != null ? modifier : SolutionModifier.none();
	}

	public AskQuery(WhereClause where) {
		this(List.of(), where, SolutionModifier.none());
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitAskQuery(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(datasets, where, modifier);
	}
}
