package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * GROUP BY, HAVING, ORDER BY and LIMIT/OFFSET, each optional. Absent clauses
 * are not rendered.
 */
public record SolutionModifier(GroupClause group, HavingClause having, OrderClause order,
		LimitOffsetClauses limitOffset) implements SparqlNode {

	private static final SolutionModifier NONE = new SolutionModifier(null, null, null, null);

	public static SolutionModifier none() {
		return NONE;
	}

	public boolean isEmpty() {
		return group == null && having == null && order == null && limitOffset == null;
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitSolutionModifier(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(group, having, order, limitOffset);
	}
}
