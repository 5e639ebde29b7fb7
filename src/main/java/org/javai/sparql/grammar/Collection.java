package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * An RDF collection {@code (a b c)} in a template.
 */
public record Collection(List<GraphNode> items) implements TriplesNode {

	public Collection {
		items = Nodes.nonEmpty("Collection", items, "item");
	}

	public static Collection of(GraphNode... items) {
		return new Collection(List.of(items));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitCollection(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(items);
	}
}
