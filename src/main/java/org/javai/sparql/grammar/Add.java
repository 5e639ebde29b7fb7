package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code ADD [SILENT] from TO to}.
 */
public record Add(boolean silent, GraphOrDefault from, GraphOrDefault to) implements Update1 {

	public Add {
		Nodes.require(from, "from");
		Nodes.require(to, "to");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitAdd(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(from, to);
	}
}
