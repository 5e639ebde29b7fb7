package org.javai.sparql.grammar;

import java.util.ArrayList;
import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A unary expression followed by {@code * x} and {@code / x} factors.
 */
public record MultiplicativeExpression(UnaryExpression first, List<Factor> factors) implements SparqlNode {

	public record Factor(MultiplicativeOperator operator, UnaryExpression operand) {

		public Factor {
			Nodes.require(operator, "operator");
			Nodes.require(operand, "operand");
		}
	}

	public MultiplicativeExpression {
		Nodes.require(first, "first");
		factors = Nodes.copy("MultiplicativeExpression", factors);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitMultiplicativeExpression(this);
	}

	@Override
	public List<SparqlNode> children() {
		List<SparqlNode> children = new ArrayList<>();
		children.add(first);
		for (Factor factor : factors) {
			children.add(factor.operand());
		}
		return List.copyOf(children);
	}
}
