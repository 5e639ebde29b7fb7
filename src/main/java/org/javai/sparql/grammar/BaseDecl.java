package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.terminal.IriRef;

public record BaseDecl(IriRef iri) implements PrologueDecl {

	public BaseDecl {
		Nodes.require(iri, "iri");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitBaseDecl(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(iri);
	}
}
