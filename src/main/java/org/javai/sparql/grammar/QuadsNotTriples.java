package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code GRAPH graph { template }}. The template is absent for an empty block.
 */
public record QuadsNotTriples(VarOrIri graph, TriplesTemplate template) implements SparqlNode {

	public QuadsNotTriples {
		Nodes.require(graph, "graph");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitQuadsNotTriples(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(graph, template);
	}
}
