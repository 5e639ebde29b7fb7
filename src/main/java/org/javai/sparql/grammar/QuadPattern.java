package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * Braced quads that may contain variables.
 */
public record QuadPattern(Quads quads) implements SparqlNode {

	public QuadPattern {
		Nodes.require(quads, "quads");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitQuadPattern(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(quads);
	}
}
