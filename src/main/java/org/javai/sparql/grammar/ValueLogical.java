package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record ValueLogical(RelationalExpression relational) implements SparqlNode {

	public ValueLogical {
		Nodes.require(relational, "relational");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitValueLogical(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(relational);
	}
}
