package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code SUM}, {@code MIN}, {@code MAX}, {@code AVG} or {@code SAMPLE} over one expression.
 */
public record SimpleAggregate(AggregateFunction function, boolean distinct, Expression expression)
		implements Aggregate {

	public SimpleAggregate {
		Nodes.require(function, "function");
		Nodes.require(expression, "expression");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitSimpleAggregate(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(expression);
	}
}
