package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * Objects sharing a subject and verb, rendered comma separated.
 */
public record ObjectList(GraphNode first, List<GraphNode> rest) implements SparqlNode {

	public ObjectList {
		Nodes.require(first, "first");
		rest = Nodes.copy("ObjectList", rest);
	}

	public static ObjectList of(List<? extends GraphNode> items) {
		return new ObjectList(Nodes.head("ObjectList", items), Nodes.tail(items));
	}

	public static ObjectList of(GraphNode first, GraphNode... rest) {
		return new ObjectList(first, List.of(rest));
	}

	public List<GraphNode> items() {
		return Nodes.items(first, rest);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitObjectList(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(first, rest);
	}
}
