package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A braced group, {@code { ... }}.
 */
public record GroupGraphPattern(GroupGraphPatternContent content) implements SparqlNode {

	public GroupGraphPattern {
		Nodes.require(content, "content");
	}

	/**
	 * A group holding a single triples block.
	 */
	public static GroupGraphPattern of(TriplesBlock block) {
		return new GroupGraphPattern(GroupGraphPatternSub.of(block));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitGroupGraphPattern(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(content);
	}
}
