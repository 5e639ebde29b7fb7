package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * Triples templates interleaved with GRAPH blocks. Template {@code i + 1}
 * follows GRAPH block {@code i}; there is at least one template, and
 * {@code n > 1} templates need at least {@code n - 1} GRAPH blocks.
 */
public record Quads(List<TriplesTemplate> templates, List<QuadsNotTriples> graphs) implements SparqlNode {

	public Quads {
		templates = Nodes.copy("Quads", templates);
		graphs = Nodes.copy("Quads", graphs);
		Nodes.checkInterleaving("Quads", templates.size(), graphs.size(), "TriplesTemplate", "QuadsNotTriples");
	}

	public static Quads of(TriplesTemplate template, QuadsNotTriples... graphs) {
		return new Quads(List.of(template), List.of(graphs));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitQuads(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(Interleaving.order(templates, graphs));
	}
}
