package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record DeleteClause(QuadPattern pattern) implements SparqlNode {

	public DeleteClause {
		Nodes.require(pattern, "pattern");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitDeleteClause(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(pattern);
	}
}
