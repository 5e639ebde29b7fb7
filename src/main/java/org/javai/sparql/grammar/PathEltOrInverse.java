package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A path step, traversed backwards ({@code ^elt}) when {@code inverse} is set.
 */
public record PathEltOrInverse(boolean inverse, PathElt element) implements SparqlNode {

	public PathEltOrInverse {
		Nodes.require(element, "element");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitPathEltOrInverse(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(element);
	}
}
