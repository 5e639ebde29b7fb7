package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code GRAPH ?g { ... }}.
 */
public record GraphGraphPattern(VarOrIri graph, GroupGraphPattern pattern) implements GraphPatternNotTriples {

	public GraphGraphPattern {
		Nodes.require(graph, "graph");
		Nodes.require(pattern, "pattern");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitGraphGraphPattern(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(graph, pattern);
	}
}
