package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A parenthesized, comma separated expression list. May be empty.
 */
public record ExpressionList(List<Expression> expressions) implements SparqlNode {

	public ExpressionList {
		expressions = Nodes.copy("ExpressionList", expressions);
	}

	public static ExpressionList of(Expression... expressions) {
		return new ExpressionList(List.of(expressions));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitExpressionList(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(expressions);
	}
}
