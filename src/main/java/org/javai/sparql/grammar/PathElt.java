package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A path primary with an optional repetition modifier.
 */
public record PathElt(PathPrimary primary, PathMod modifier) implements SparqlNode {

	public PathElt {
		Nodes.require(primary, "primary");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitPathElt(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(primary);
	}
}
