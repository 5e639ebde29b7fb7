package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.terminal.VarToken;

/**
 * A query variable.
 */
public record Var(VarToken token) implements VarOrTerm, VarOrIri, PrimaryExpression, GroupCondition,
		OrderCondition, SelectItem, PathVerb {

	public Var {
		Nodes.require(token, "token");
	}

	/**
	 * A {@code ?name} variable.
	 */
	public static Var of(String name) {
		return new Var(new VarToken(name));
	}

	public String name() {
		return token.raw();
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitVar(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(token);
	}
}
