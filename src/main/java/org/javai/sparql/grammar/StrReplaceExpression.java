package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code REPLACE(arg, pattern, replacement[, flags])}.
 */
public record StrReplaceExpression(Expression arg, Expression pattern, Expression replacement, Expression flags)
		implements BuiltInCall {

	public StrReplaceExpression {
		Nodes.require(arg, "arg");
		Nodes.require(pattern, "pattern");
		Nodes.require(replacement, "replacement");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitStrReplaceExpression(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(arg, pattern, replacement, flags);
	}
}
