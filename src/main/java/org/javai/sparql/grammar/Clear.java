package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code CLEAR [SILENT] target}.
 */
public record Clear(boolean silent, GraphRefAll target) implements Update1 {

	public Clear {
		Nodes.require(target, "target");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitClear(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(target);
	}
}
