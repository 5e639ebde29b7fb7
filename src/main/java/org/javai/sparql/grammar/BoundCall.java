package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code BOUND(?var)}.
 */
public record BoundCall(Var var) implements BuiltInCall {

	public BoundCall {
		Nodes.require(var, "var");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitBoundCall(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(var);
	}
}
