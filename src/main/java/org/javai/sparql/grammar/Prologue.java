package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * BASE and PREFIX declarations, in order. May be empty.
 */
public record Prologue(List<PrologueDecl> declarations) implements SparqlNode {

	private static final Prologue EMPTY = new Prologue(List.of());

	public Prologue {
		declarations = Nodes.copy("Prologue", declarations);
	}

	public static Prologue empty() {
		return EMPTY;
	}

	public static Prologue of(PrologueDecl... declarations) {
		return new Prologue(List.of(declarations));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitPrologue(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(declarations);
	}
}
