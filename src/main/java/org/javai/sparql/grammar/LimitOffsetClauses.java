package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.StructuralException;

/**
 * LIMIT and OFFSET, at least one of them present. LIMIT renders first.
 */
public record LimitOffsetClauses(LimitClause limit, OffsetClause offset) implements SparqlNode {

	public LimitOffsetClauses {
		if (limit == null && offset == null) {
			throw new StructuralException("LimitOffsetClauses", "a LIMIT or an OFFSET clause is required");
		}
	}

	public static LimitOffsetClauses limit(long limit) {
		return new LimitOffsetClauses(new LimitClause(limit), null);
	}

	public static LimitOffsetClauses of(long limit, long offset) {
		return new LimitOffsetClauses(new LimitClause(limit), new OffsetClause(offset));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitLimitOffsetClauses(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(limit, offset);
	}
}
