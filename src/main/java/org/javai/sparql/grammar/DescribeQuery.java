package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code DESCRIBE targets}. No targets describes every variable and renders
 * {@code *}. The WHERE clause is optional.
 */
public record DescribeQuery(List<VarOrIri> targets, List<DatasetClause> datasets, WhereClause where,
		SolutionModifier modifier) implements QueryForm {

	public DescribeQuery {
		targets = Nodes.copy("DescribeQuery", targets);
		datasets = Nodes.copy("DescribeQuery", datasets);
		modifier = modifier != null ? modifier : SolutionModifier.none();
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitDescribeQuery(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(targets, datasets, where, modifier);
	}
}
