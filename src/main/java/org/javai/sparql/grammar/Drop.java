package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code DROP [SILENT] target}.
 */
public record Drop(boolean silent, GraphRefAll target) implements Update1 {

	public Drop {
		Nodes.require(target, "target");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitDrop(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(target);
	}
}
