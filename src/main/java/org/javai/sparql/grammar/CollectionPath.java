package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record CollectionPath(List<GraphNodePath> items) implements TriplesNodePath {

	public CollectionPath {
		items = Nodes.nonEmpty("CollectionPath", items, "item");
	}

	public static CollectionPath of(GraphNodePath... items) {
		return new CollectionPath(List.of(items));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitCollectionPath(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(items);
	}
}
