package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.terminal.Nil;

/**
 * The empty RDF list {@code ()} used as a term.
 */
public record NilTerm(Nil nil) implements GraphTerm {

	public NilTerm {
		Nodes.require(nil, "nil");
	}

	public NilTerm() {
		this(new Nil());
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitNilTerm(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(nil);
	}
}
