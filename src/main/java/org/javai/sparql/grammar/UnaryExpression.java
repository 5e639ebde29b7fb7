package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A primary expression with an optional {@code !}, {@code +} or {@code -} prefix.
 */
public record UnaryExpression(UnaryOperator operator, PrimaryExpression operand) implements SparqlNode {

	public UnaryExpression {
		Nodes.require(operand, "operand");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitUnaryExpression(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(operand);
	}
}
