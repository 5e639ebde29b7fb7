package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * Operands joined by {@code ||}.
 */
public record ConditionalOrExpression(ConditionalAndExpression first, List<ConditionalAndExpression> rest)
		implements SparqlNode {

	public ConditionalOrExpression {
		Nodes.require(first, "first");
		rest = Nodes.copy("ConditionalOrExpression", rest);
	}

	public static ConditionalOrExpression of(List<ConditionalAndExpression> items) {
		return new ConditionalOrExpression(Nodes.head("ConditionalOrExpression", items), Nodes.tail(items));
	}

	public static ConditionalOrExpression of(ConditionalAndExpression first, ConditionalAndExpression... rest) {
		return new ConditionalOrExpression(first, List.of(rest));
	}

	public List<ConditionalAndExpression> items() {
		return Nodes.items(first, rest);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitConditionalOrExpression(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(first, rest);
	}
}
