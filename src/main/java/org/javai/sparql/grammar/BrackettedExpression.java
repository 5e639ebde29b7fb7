package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record BrackettedExpression(Expression expression) implements PrimaryExpression, Constraint {

	public BrackettedExpression {
		Nodes.require(expression, "expression");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitBrackettedExpression(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(expression);
	}
}
