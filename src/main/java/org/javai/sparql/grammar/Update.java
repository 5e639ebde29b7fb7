package org.javai.sparql.grammar;

import java.util.ArrayList;
import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.StructuralException;

/**
 * A prologue and an update operation, optionally followed by further
 * requests separated by {@code ;}. A request without an operation is legal
 * only as the last one.
 */
public record Update(Prologue prologue, Update1 operation, Update next) implements SparqlNode {

	public Update {
		Nodes.require(prologue, "prologue");
		if (operation == null && next != null) {
			throw new StructuralException("Update", "a request followed by another request needs an operation");
		}
	}

	/**
	 * Chains the operations in order, each with an empty prologue.
	 */
	public static Update of(List<? extends Update1> operations) {
		return of(Prologue.empty(), operations);
	}

	/**
	 * Chains the operations in order. The prologue applies to the first one.
	 */
	public static Update of(Prologue prologue, List<? extends Update1> operations) {
		Nodes.require(prologue, "prologue");
		if (operations == null || operations.isEmpty()) {
			throw new StructuralException("Update", "at least one operation is required");
		}
		Update chain = null;
		for (int i = operations.size() - 1; i >= 0; i--) {
			chain = new Update(i == 0 ? prologue : Prologue.empty(),
				Nodes.require(operations.get(i), "operation"), chain);
		}
		return chain;
	}

	public static Update of(Update1 first, Update1... rest) {
		List<Update1> operations = new ArrayList<>();
		operations.add(first);
		operations.addAll(List.of(rest));
		return of(operations);
	}

	/**
	 * The operations of this request and all following ones, in order.
	 */
	public List<Update1> operations() {
		List<Update1> operations = new ArrayList<>();
		for (Update update = this; update != null; update = update.next()) {
			if (update.operation() != null) {
				operations.add(update.operation());
			}
		}
		return List.copyOf(operations);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitUpdate(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(prologue, operation, next);
	}
}
