package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code !iri} or {@code !(iri1|^iri2)}. The parentheses are rendered only
 * when the set has more than one member.
 */
public record PathNegatedPropertySet(PathOneInPropertySet first, List<PathOneInPropertySet> rest)
		implements PathPrimary {

	public PathNegatedPropertySet {
		Nodes.require(first, "first");
		rest = Nodes.copy("PathNegatedPropertySet", rest);
	}

	public static PathNegatedPropertySet of(List<PathOneInPropertySet> items) {
		return new PathNegatedPropertySet(Nodes.head("PathNegatedPropertySet", items), Nodes.tail(items));
	}

	public static PathNegatedPropertySet of(PathOneInPropertySet first, PathOneInPropertySet... rest) {
		return new PathNegatedPropertySet(first, List.of(rest));
	}

	public List<PathOneInPropertySet> items() {
		return Nodes.items(first, rest);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitPathNegatedPropertySet(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(first, rest);
	}
}
