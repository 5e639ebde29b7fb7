package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.StructuralException;

/**
 * {@code DEFAULT} when the IRI is absent, otherwise the IRI with an optional
 * {@code GRAPH} keyword.
 */
public record GraphOrDefault(Iri iri, boolean graphKeyword) implements SparqlNode {

	public GraphOrDefault {
		if (iri == null && graphKeyword) {
			throw new StructuralException("GraphOrDefault", "the GRAPH keyword needs an IRI");
		}
	}

	public static GraphOrDefault defaultGraph() {
		return new GraphOrDefault(null, false);
	}

	public static GraphOrDefault graph(Iri iri) {
		return new GraphOrDefault(Nodes.require(iri, "iri"), true);
	}

	public boolean isDefault() {
		return iri == null;
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitGraphOrDefault(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(iri);
	}
}
