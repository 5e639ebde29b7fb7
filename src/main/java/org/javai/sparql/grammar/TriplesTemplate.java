package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * The triples of a quad block or a {@code CONSTRUCT WHERE} template.
 */
public record TriplesTemplate(TriplesSameSubject first, List<TriplesSameSubject> rest) implements SparqlNode {

	public TriplesTemplate {
		Nodes.require(first, "first");
		rest = Nodes.copy("TriplesTemplate", rest);
	}

	public static TriplesTemplate of(List<TriplesSameSubject> items) {
		return new TriplesTemplate(Nodes.head("TriplesTemplate", items), Nodes.tail(items));
	}

	public static TriplesTemplate of(TriplesSameSubject first, TriplesSameSubject... rest) {
		return new TriplesTemplate(first, List.of(rest));
	}

	public List<TriplesSameSubject> items() {
		return Nodes.items(first, rest);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitTriplesTemplate(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(first, rest);
	}
}
