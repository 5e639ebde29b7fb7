package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record Expression(ConditionalOrExpression or) implements SparqlNode {

	public Expression {
		Nodes.require(or, "or");
	}

	/**
	 * The minimal expression chain around a single relational expression.
	 */
	public static Expression of(RelationalExpression relational) {
		return new Expression(ConditionalOrExpression.of(
			ConditionalAndExpression.of(new ValueLogical(relational))));
	}

	/**
	 * The minimal expression chain around a single primary expression.
	 */
	public static Expression of(PrimaryExpression primary) {
		return of(new RelationalExpression(NumericExpression.of(primary), null));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitExpression(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(or);
	}
}
