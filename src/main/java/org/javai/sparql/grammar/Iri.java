package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.terminal.IriRef;
import org.javai.sparql.terminal.IriToken;
import org.javai.sparql.terminal.PnameLn;

/**
 * An IRI written as a full reference or a prefixed name.
 */
public record Iri(IriToken token) implements GraphTerm, VarOrIri, PathPrimary, IriOrA, DataBlockValue {

	public Iri {
		Nodes.require(token, "token");
	}

	/**
	 * An IRI written in full, rendered as {@code <iri>}.
	 */
	public static Iri of(String iri) {
		return new Iri(new IriRef(iri));
	}

	/**
	 * An IRI written as a prefixed name such as {@code foaf:name}.
	 */
	public static Iri prefixed(String prefixedName) {
		return new Iri(new PnameLn(prefixedName));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitIri(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(token);
	}
}
