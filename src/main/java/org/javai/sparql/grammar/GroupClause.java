package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record GroupClause(List<GroupCondition> conditions) implements SparqlNode {

	public GroupClause {
		conditions = Nodes.nonEmpty("GroupClause", conditions, "condition");
	}

	public static GroupClause of(GroupCondition... conditions) {
		return new GroupClause(List.of(conditions));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitGroupClause(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(conditions);
	}
}
