package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * An anonymous blank node with properties, {@code [ :p :o ]}.
 */
public record BlankNodePropertyList(PropertyListNotEmpty properties) implements TriplesNode {

	public BlankNodePropertyList {
		Nodes.require(properties, "properties");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitBlankNodePropertyList(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(properties);
	}
}
