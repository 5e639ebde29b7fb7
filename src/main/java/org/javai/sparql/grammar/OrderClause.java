package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record OrderClause(List<OrderCondition> conditions) implements SparqlNode {

	public OrderClause {
		conditions = Nodes.nonEmpty("OrderClause", conditions, "condition");
	}

	public static OrderClause of(OrderCondition... conditions) {
		return new OrderClause(List.of(conditions));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitOrderClause(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(conditions);
	}
}
