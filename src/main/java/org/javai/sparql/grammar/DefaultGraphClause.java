package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code FROM <iri>}.
 */
public record DefaultGraphClause(Iri source) implements DatasetClause {

	public DefaultGraphClause {
		Nodes.require(source, "source");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitDefaultGraphClause(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(source);
	}
}
