package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record InsertClause(QuadPattern pattern) implements SparqlNode {

	public InsertClause {
		Nodes.require(pattern, "pattern");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitInsertClause(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(pattern);
	}
}
