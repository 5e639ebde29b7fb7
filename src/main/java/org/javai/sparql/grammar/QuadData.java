package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * Braced ground quads for INSERT DATA and DELETE DATA.
 */
public record QuadData(Quads quads) implements SparqlNode {

	public QuadData {
		Nodes.require(quads, "quads");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitQuadData(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(quads);
	}
}
