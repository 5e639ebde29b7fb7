package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A property path: one or more sequences joined by {@code |}.
 */
public record PathAlternative(PathSequence first, List<PathSequence> rest) implements PathVerb {

	public PathAlternative {
		Nodes.require(first, "first");
		rest = Nodes.copy("PathAlternative", rest);
	}

	public static PathAlternative of(List<PathSequence> items) {
		return new PathAlternative(Nodes.head("PathAlternative", items), Nodes.tail(items));
	}

	public static PathAlternative of(PathSequence first, PathSequence... rest) {
		return new PathAlternative(first, List.of(rest));
	}

	/**
	 * The single-step path {@code iri}.
	 */
	public static PathAlternative of(Iri iri) {
		return of(PathSequence.of(new PathEltOrInverse(false, new PathElt(iri, null))));
	}

	public List<PathSequence> items() {
		return Nodes.items(first, rest);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitPathAlternative(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(first, rest);
	}
}
