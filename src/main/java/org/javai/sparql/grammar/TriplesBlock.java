package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * Consecutive triples of a graph pattern, rendered separated by {@code  . }.
 */
public record TriplesBlock(TriplesSameSubjectPath first, List<TriplesSameSubjectPath> rest) implements SparqlNode {

	public TriplesBlock {
		Nodes.require(first, "first");
		rest = Nodes.copy("TriplesBlock", rest);
	}

	public static TriplesBlock of(List<TriplesSameSubjectPath> items) {
		return new TriplesBlock(Nodes.head("TriplesBlock", items), Nodes.tail(items));
	}

	public static TriplesBlock of(TriplesSameSubjectPath first, TriplesSameSubjectPath... rest) {
		return new TriplesBlock(first, List.of(rest));
	}

	public List<TriplesSameSubjectPath> items() {
		return Nodes.items(first, rest);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitTriplesBlock(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(first, rest);
	}
}
