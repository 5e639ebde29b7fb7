package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * The short form {@code CONSTRUCT WHERE { template }}, where the template is
 * also the pattern to match.
 */
public record ConstructWhereQuery(List<DatasetClause> datasets, TriplesTemplate template,
		SolutionModifier modifier) implements QueryForm {

	public ConstructWhereQuery {
		datasets = Nodes.copy("ConstructWhereQuery", datasets);
		modifier = modifier != null ? modifier : SolutionModifier.none();
	}

	public ConstructWhereQuery(TriplesTemplate template) {
		this(List.of(), template, SolutionModifier.none());
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitConstructWhereQuery(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(datasets, template, modifier);
	}
}
