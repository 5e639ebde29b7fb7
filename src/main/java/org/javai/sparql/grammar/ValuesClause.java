package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A VALUES clause trailing a query.
 */
public record ValuesClause(DataBlock block) implements SparqlNode {

	public ValuesClause {
		Nodes.require(block, "block");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitValuesClause(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(block);
	}
}
