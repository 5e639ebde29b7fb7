package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record Create(boolean silent, GraphRef graph) implements Update1 {

	public Create {
		Nodes.require(graph, "graph");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitCreate(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(graph);
	}
}
