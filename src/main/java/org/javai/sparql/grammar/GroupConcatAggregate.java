package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.terminal.StringToken;

/**
 * {@code GROUP_CONCAT([DISTINCT] expression[; SEPARATOR="sep"])}.
 */
public record GroupConcatAggregate(boolean distinct, Expression expression, StringToken separator)
		implements Aggregate {

	public GroupConcatAggregate {
		Nodes.require(expression, "expression");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitGroupConcatAggregate(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(expression, separator);
	}
}
