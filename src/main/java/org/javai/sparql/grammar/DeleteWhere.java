package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code DELETE WHERE { quads }}.
 */
public record DeleteWhere(QuadPattern pattern) implements Update1 {

	public DeleteWhere {
		Nodes.require(pattern, "pattern");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitDeleteWhere(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(pattern);
	}
}
