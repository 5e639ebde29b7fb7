package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A group, or groups joined by {@code UNION}.
 */
public record GroupOrUnionGraphPattern(GroupGraphPattern first, List<GroupGraphPattern> rest)
		implements GraphPatternNotTriples {

	public GroupOrUnionGraphPattern {
		Nodes.require(first, "first");
		rest = Nodes.copy("GroupOrUnionGraphPattern", rest);
	}

	public static GroupOrUnionGraphPattern of(List<GroupGraphPattern> items) {
		return new GroupOrUnionGraphPattern(Nodes.head("GroupOrUnionGraphPattern", items), Nodes.tail(items));
	}

	public static GroupOrUnionGraphPattern of(GroupGraphPattern first, GroupGraphPattern... rest) {
		return new GroupOrUnionGraphPattern(first, List.of(rest));
	}

	public List<GroupGraphPattern> items() {
		return Nodes.items(first, rest);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitGroupOrUnionGraphPattern(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(first, rest);
	}
}
