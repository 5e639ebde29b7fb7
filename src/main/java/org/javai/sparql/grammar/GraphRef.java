package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code GRAPH <iri>}.
 */
public record GraphRef(Iri iri) implements GraphRefAll {

	public GraphRef {
		Nodes.require(iri, "iri");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitGraphRef(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(iri);
	}
}
