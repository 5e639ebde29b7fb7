package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * The triples of a CONSTRUCT template.
 */
public record ConstructTriples(TriplesSameSubject first, List<TriplesSameSubject> rest) implements SparqlNode {

	public ConstructTriples {
		Nodes.require(first, "first");
		rest = Nodes.copy("ConstructTriples", rest);
	}

	public static ConstructTriples of(List<TriplesSameSubject> items) {
		return new ConstructTriples(Nodes.head("ConstructTriples", items), Nodes.tail(items));
	}

	public static ConstructTriples of(TriplesSameSubject first, TriplesSameSubject... rest) {
		return new ConstructTriples(first, List.of(rest));
	}

	public List<TriplesSameSubject> items() {
		return Nodes.items(first, rest);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitConstructTriples(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(first, rest);
	}
}
