package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record ConstructQuery(ConstructTemplate template, List<DatasetClause> datasets, WhereClause where,
		SolutionModifier modifier) implements QueryForm {

	public ConstructQuery {
		Nodes.require(template, "template");
		datasets = Nodes.copy("ConstructQuery", datasets);
		Nodes.require(where, "where");
		modifier = modifier != null ? modifier : SolutionModifier.none();
	}

	public ConstructQuery(ConstructTemplate template, WhereClause where) {
		this(template, List.of(), where, SolutionModifier.none());
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitConstructQuery(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(template, datasets, where, modifier);
	}
}
