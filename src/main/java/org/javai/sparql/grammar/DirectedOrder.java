package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * An order condition with an explicit direction, rendered as {@code DESC(expression)}.
 */
public record DirectedOrder(OrderDirection direction, BrackettedExpression expression) implements OrderCondition {

	public DirectedOrder {
		Nodes.require(direction, "direction");
		Nodes.require(expression, "expression");
	}

	public static DirectedOrder ascending(Expression expression) {
		return new DirectedOrder(OrderDirection.ASC, new BrackettedExpression(expression));
	}

	public static DirectedOrder descending(Expression expression) {
		return new DirectedOrder(OrderDirection.DESC, new BrackettedExpression(expression));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitDirectedOrder(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(expression);
	}
}
