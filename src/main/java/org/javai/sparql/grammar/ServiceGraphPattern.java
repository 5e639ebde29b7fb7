package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code SERVICE [SILENT] endpoint { ... }}.
 */
public record ServiceGraphPattern(boolean silent, VarOrIri endpoint, GroupGraphPattern pattern)
		implements GraphPatternNotTriples {

	public ServiceGraphPattern {
		Nodes.require(endpoint, "endpoint");
		Nodes.require(pattern, "pattern");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitServiceGraphPattern(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(endpoint, pattern);
	}
}
