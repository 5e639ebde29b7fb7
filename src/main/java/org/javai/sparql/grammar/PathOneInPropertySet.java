package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record PathOneInPropertySet(boolean inverse, IriOrA target) implements SparqlNode {

	public PathOneInPropertySet {
		Nodes.require(target, "target");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitPathOneInPropertySet(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(target);
	}
}
