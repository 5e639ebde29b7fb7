package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.StructuralException;

/**
 * Function arguments, {@code (DISTINCT a, b)}. No arguments renders as
 * {@code ()} and cannot be DISTINCT.
 */
public record ArgList(boolean distinct, List<Expression> args) implements SparqlNode {

	public ArgList {
		args = Nodes.copy("ArgList", args);
		if (distinct && args.isEmpty()) {
			throw new StructuralException("ArgList", "DISTINCT needs at least one argument");
		}
	}

	public static ArgList of(Expression... args) {
		return new ArgList(false, List.of(args));
	}

	public static ArgList empty() {
		return new ArgList(false, List.of());
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitArgList(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(args);
	}
}
