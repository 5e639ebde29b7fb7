package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A grouping expression, {@code (expression)} or {@code (expression AS ?var)}.
 */
public record GroupBinding(Expression expression, Var var) implements GroupCondition {

	public GroupBinding {
		Nodes.require(expression, "expression");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitGroupBinding(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(expression, var);
	}
}
