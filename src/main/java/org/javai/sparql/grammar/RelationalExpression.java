package org.javai.sparql.grammar;

import java.util.ArrayList;
import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A numeric expression, optionally compared with another one or tested for
 * membership in an expression list.
 */
public record RelationalExpression(NumericExpression left, Tail tail) implements SparqlNode {

	/**
	 * What follows the left operand.
	 */
	public sealed interface Tail permits Comparison, Membership {
	}

	public record Comparison(ComparisonOperator operator, NumericExpression right) implements Tail {

		public Comparison {
			Nodes.require(operator, "operator");
			Nodes.require(right, "right");
		}
	}

	public record Membership(MembershipOperator operator, ExpressionList list) implements Tail {

		public Membership {
			Nodes.require(operator, "operator");
			Nodes.require(list, "list");
		}
	}

	public RelationalExpression {
		Nodes.require(left, "left");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitRelationalExpression(this);
	}

	@Override
	public List<SparqlNode> children() {
		List<SparqlNode> children = new ArrayList<>();
		children.add(left);
		if (tail instanceof Comparison comparison) {
			children.add(comparison.right());
		} else if (tail instanceof Membership membership) {
			children.add(membership.list());
		}
		return List.copyOf(children);
	}
}
