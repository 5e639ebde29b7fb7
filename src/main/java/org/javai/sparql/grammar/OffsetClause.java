package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.StructuralException;

public record OffsetClause(long offset) implements SparqlNode {

	public OffsetClause {
		if (offset < 0) {
			throw new StructuralException("OffsetClause", "OFFSET must not be negative: " + offset);
		}
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitOffsetClause(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of();
	}
}
