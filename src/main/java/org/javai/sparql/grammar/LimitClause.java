package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.StructuralException;

public record LimitClause(long limit) implements SparqlNode {

	public LimitClause {
		if (limit < 0) {
			throw new StructuralException("LimitClause", "LIMIT must not be negative: " + limit);
		}
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitLimitClause(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of();
	}
}
