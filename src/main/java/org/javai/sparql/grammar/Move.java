package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code MOVE [SILENT] from TO to}.
 */
public record Move(boolean silent, GraphOrDefault from, GraphOrDefault to) implements Update1 {

	public Move {
		Nodes.require(from, "from");
		Nodes.require(to, "to");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitMove(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(from, to);
	}
}
