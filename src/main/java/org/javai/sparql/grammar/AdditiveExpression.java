package org.javai.sparql.grammar;

import java.util.ArrayList;
import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.StructuralException;
import org.javai.sparql.terminal.NumericToken;

/**
 * A multiplicative expression followed by additive steps.
 *
 * <p>Besides {@code + x} and {@code - x}, the grammar admits a signed
 * numeric literal directly after the operand, as in {@code ?a -2 * ?b}.
 * That form is a {@link SignedLiteralStep} and requires an explicitly signed
 * literal.</p>
 */
public record AdditiveExpression(MultiplicativeExpression first, List<Step> steps) implements SparqlNode {

	public sealed interface Step permits AdditiveStep, SignedLiteralStep {
	}

	public record AdditiveStep(AdditiveOperator operator, MultiplicativeExpression operand) implements Step {

		public AdditiveStep {
			Nodes.require(operator, "operator");
			Nodes.require(operand, "operand");
		}
	}

	public record SignedLiteralStep(NumericLiteral literal, List<MultiplicativeExpression.Factor> factors)
			implements Step {

		public SignedLiteralStep {
			Nodes.require(literal, "literal");
			NumericToken token = literal.token();
			if (!token.isSigned()) {
				throw new StructuralException("AdditiveExpression",
					"a literal step needs an explicitly signed literal, got '" + token.render() + "'");
			}
			factors = Nodes.copy("AdditiveExpression", factors);
		}
	}

	public AdditiveExpression {
		Nodes.require(first, "first");
		steps = Nodes.copy("AdditiveExpression", steps);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitAdditiveExpression(this);
	}

	@Override
	public List<SparqlNode> children() {
		List<SparqlNode> children = new ArrayList<>();
		children.add(first);
		for (Step step : steps) {
			if (step instanceof AdditiveStep additive) {
				children.add(additive.operand());
			} else if (step instanceof SignedLiteralStep signed) {
				children.add(signed.literal());
				for (MultiplicativeExpression.Factor factor : signed.factors()) {
					children.add(factor.operand());
				}
			}
		}
		return List.copyOf(children);
	}
}
