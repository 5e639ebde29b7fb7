package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record OptionalGraphPattern(GroupGraphPattern pattern) implements GraphPatternNotTriples {

	public OptionalGraphPattern {
		Nodes.require(pattern, "pattern");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitOptionalGraphPattern(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(pattern);
	}
}
