package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code FROM NAMED <iri>}.
 */
public record NamedGraphClause(Iri source) implements DatasetClause {

	public NamedGraphClause {
		Nodes.require(source, "source");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitNamedGraphClause(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(source);
	}
}
