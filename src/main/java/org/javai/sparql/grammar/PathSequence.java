package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * Path steps joined by {@code /}.
 */
public record PathSequence(PathEltOrInverse first, List<PathEltOrInverse> rest) implements SparqlNode {

	public PathSequence {
		Nodes.require(first, "first");
		rest = Nodes.copy("PathSequence", rest);
	}

	public static PathSequence of(List<PathEltOrInverse> items) {
		return new PathSequence(Nodes.head("PathSequence", items), Nodes.tail(items));
	}

	public static PathSequence of(PathEltOrInverse first, PathEltOrInverse... rest) {
		return new PathSequence(first, List.of(rest));
	}

	public List<PathEltOrInverse> items() {
		return Nodes.items(first, rest);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitPathSequence(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(first, rest);
	}
}
