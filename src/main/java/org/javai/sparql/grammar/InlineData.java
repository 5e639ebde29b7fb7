package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A VALUES block inside a graph pattern.
 */
public record InlineData(DataBlock block) implements GraphPatternNotTriples {

	public InlineData {
		Nodes.require(block, "block");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitInlineData(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(block);
	}
}
