package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record NumericExpression(AdditiveExpression additive) implements SparqlNode {

	public NumericExpression {
		Nodes.require(additive, "additive");
	}

	/**
	 * The minimal numeric expression chain around a single primary expression.
	 */
	public static NumericExpression of(PrimaryExpression primary) {
		return new NumericExpression(new AdditiveExpression(
			new MultiplicativeExpression(new UnaryExpression(null, primary), List.of()), List.of()));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitNumericExpression(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(additive);
	}
}
