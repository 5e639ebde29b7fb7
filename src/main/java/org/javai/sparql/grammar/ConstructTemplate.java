package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * The braces around a CONSTRUCT template. The triples are absent for an
 * empty template.
 */
public record ConstructTemplate(ConstructTriples triples) implements SparqlNode {

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitConstructTemplate(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(triples);
	}
}
