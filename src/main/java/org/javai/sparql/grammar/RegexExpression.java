package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code REGEX(text, pattern[, flags])}.
 */
public record RegexExpression(Expression text, Expression pattern, Expression flags) implements BuiltInCall {

	public RegexExpression {
		Nodes.require(text, "text");
		Nodes.require(pattern, "pattern");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitRegexExpression(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(text, pattern, flags);
	}
}
