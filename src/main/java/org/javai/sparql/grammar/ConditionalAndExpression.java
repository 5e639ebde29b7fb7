package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * Operands joined by {@code &&}.
 */
public record ConditionalAndExpression(ValueLogical first, List<ValueLogical> rest) implements SparqlNode {

	public ConditionalAndExpression {
		Nodes.require(first, "first");
		rest = Nodes.copy("ConditionalAndExpression", rest);
	}

	public static ConditionalAndExpression of(List<ValueLogical> items) {
		return new ConditionalAndExpression(Nodes.head("ConditionalAndExpression", items), Nodes.tail(items));
	}

	public static ConditionalAndExpression of(ValueLogical first, ValueLogical... rest) {
		return new ConditionalAndExpression(first, List.of(rest));
	}

	public List<ValueLogical> items() {
		return Nodes.items(first, rest);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitConditionalAndExpression(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(first, rest);
	}
}
