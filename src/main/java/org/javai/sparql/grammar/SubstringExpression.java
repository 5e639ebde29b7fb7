package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code SUBSTR(source, start[, length])}.
 */
public record SubstringExpression(Expression source, Expression start, Expression length) implements BuiltInCall {

	public SubstringExpression {
		Nodes.require(source, "source");
		Nodes.require(start, "start");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitSubstringExpression(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(source, start, length);
	}
}
