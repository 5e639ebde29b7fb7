package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code COUNT([DISTINCT] expression)}, or {@code COUNT([DISTINCT] *)} when
 * the expression is absent.
 */
public record CountAggregate(boolean distinct, Expression expression) implements Aggregate {

	public static CountAggregate all() {
		return new CountAggregate(false, null);
	}

	public boolean countsAll() {
		return expression == null;
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitCountAggregate(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(expression);
	}
}
