package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record WhereClause(GroupGraphPattern pattern) implements SparqlNode {

	public WhereClause {
		Nodes.require(pattern, "pattern");
	}

	public static WhereClause of(TriplesBlock block) {
		return new WhereClause(GroupGraphPattern.of(block));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitWhereClause(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(pattern);
	}
}
