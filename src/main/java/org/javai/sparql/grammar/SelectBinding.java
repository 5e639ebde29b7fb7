package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A projected expression, {@code (expression AS ?var)}.
 */
public record SelectBinding(Expression expression, Var var) implements SelectItem {

	public SelectBinding {
		Nodes.require(expression, "expression");
		Nodes.require(var, "var");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitSelectBinding(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(expression, var);
	}
}
