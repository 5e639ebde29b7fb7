package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record UpdateUnit(Update update) implements SparqlNode {

	public UpdateUnit {
		Nodes.require(update, "update");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitUpdateUnit(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(update);
	}
}
