package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * The {@code a} keyword, shorthand for {@code rdf:type} in predicate position.
 */
public enum RdfTypeKeyword implements Verb, PathPrimary, IriOrA {
	A;

	public String keyword() {
		return "a";
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitRdfTypeKeyword(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of();
	}
}
