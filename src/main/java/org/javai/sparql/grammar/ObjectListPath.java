package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record ObjectListPath(GraphNodePath first, List<GraphNodePath> rest) implements SparqlNode {

	public ObjectListPath {
		Nodes.require(first, "first");
		rest = Nodes.copy("ObjectListPath", rest);
	}

	public static ObjectListPath of(List<? extends GraphNodePath> items) {
		return new ObjectListPath(Nodes.head("ObjectListPath", items), Nodes.tail(items));
	}

	public static ObjectListPath of(GraphNodePath first, GraphNodePath... rest) {
		return new ObjectListPath(first, List.of(rest));
	}

	public List<GraphNodePath> items() {
		return Nodes.items(first, rest);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitObjectListPath(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(first, rest);
	}
}
