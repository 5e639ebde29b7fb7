package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record DeleteData(QuadData data) implements Update1 {

	public DeleteData {
		Nodes.require(data, "data");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitDeleteData(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(data);
	}
}
