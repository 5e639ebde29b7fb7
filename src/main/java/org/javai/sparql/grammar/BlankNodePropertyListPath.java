package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record BlankNodePropertyListPath(PropertyListPathNotEmpty properties) implements TriplesNodePath {

	public BlankNodePropertyListPath {
		Nodes.require(properties, "properties");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitBlankNodePropertyListPath(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(properties);
	}
}
