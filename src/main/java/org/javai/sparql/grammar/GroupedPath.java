package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A parenthesized path used as a primary, rendered as {@code (path)}.
 */
public record GroupedPath(PathAlternative path) implements PathPrimary {

	public GroupedPath {
		Nodes.require(path, "path");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitGroupedPath(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(path);
	}
}
