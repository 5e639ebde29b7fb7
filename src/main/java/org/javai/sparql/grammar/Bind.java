package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code BIND(expression AS ?var)}.
 */
public record Bind(Expression expression, Var var) implements GraphPatternNotTriples {

	public Bind {
		Nodes.require(expression, "expression");
		Nodes.require(var, "var");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitBind(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(expression, var);
	}
}
