package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.terminal.IriRef;
import org.javai.sparql.terminal.PnameNs;

/**
 * {@code PREFIX label: <iri>}.
 */
public record PrefixDecl(PnameNs prefix, IriRef iri) implements PrologueDecl {

	public PrefixDecl {
		Nodes.require(prefix, "prefix");
		Nodes.require(iri, "iri");
	}

	public static PrefixDecl of(String label, String iri) {
		return new PrefixDecl(new PnameNs(label), new IriRef(iri));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitPrefixDecl(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(prefix, iri);
	}
}
