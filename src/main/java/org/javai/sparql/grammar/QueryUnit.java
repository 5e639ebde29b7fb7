package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record QueryUnit(Query query) implements SparqlNode {

	public QueryUnit {
		Nodes.require(query, "query");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitQueryUnit(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(query);
	}
}
