package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.terminal.Anon;
import org.javai.sparql.terminal.BlankNodeLabel;
import org.javai.sparql.terminal.BlankNodeToken;

public record BlankNode(BlankNodeToken token) implements GraphTerm {

	public BlankNode {
		Nodes.require(token, "token");
	}

	/**
	 * A labelled blank node, rendered as {@code _:label}.
	 */
	public static BlankNode labelled(String label) {
		return new BlankNode(new BlankNodeLabel(label));
	}

	/**
	 * The anonymous blank node {@code []}.
	 */
	public static BlankNode anonymous() {
		return new BlankNode(new Anon());
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitBlankNode(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(token);
	}
}
