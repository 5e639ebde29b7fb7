package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public enum GraphRefAllKeyword implements GraphRefAll {
	DEFAULT,
	NAMED,
	ALL;

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitGraphRefAllKeyword(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of();
	}
}
