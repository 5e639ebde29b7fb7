package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code COPY [SILENT] from TO to}.
 */
public record Copy(boolean silent, GraphOrDefault from, GraphOrDefault to) implements Update1 {

	public Copy {
		Nodes.require(from, "from");
		Nodes.require(to, "to");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitCopy(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(from, to);
	}
}
