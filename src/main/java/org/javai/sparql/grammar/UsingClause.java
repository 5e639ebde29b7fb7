package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code USING <iri>} or {@code USING NAMED <iri>}.
 */
public record UsingClause(Iri iri, boolean named) implements SparqlNode {

	public UsingClause {
		Nodes.require(iri, "iri");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitUsingClause(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(iri);
	}
}
