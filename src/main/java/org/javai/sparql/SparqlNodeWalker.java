package org.javai.sparql;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Utility class for walking SPARQL node trees through {@link SparqlNode#children()}.
 */
public final class SparqlNodeWalker {

	private SparqlNodeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits every node of the tree in pre-order (node before its children).
	 *
	 * @param node the root node to start traversal from
	 * @param action the action applied to each node
	 */
	public static void walkPreOrder(SparqlNode node, Consumer<SparqlNode> action) {
		walk(node, n -> {
			action.accept(n);
			return true;
		});
	}

	/**
	 * Visits every node of the tree in post-order (children before the node).
	 *
	 * @param node the root node to start traversal from
	 * @param action the action applied to each node
	 */
	public static void walkPostOrder(SparqlNode node, Consumer<SparqlNode> action) {
		if (node == null) {
			return;
		}
		for (SparqlNode child : node.children()) {
			walkPostOrder(child, action);
		}
		action.accept(node);
	}

	/**
	 * Pre-order walk that descends into a node's children only while
	 * {@code descend} returns {@code true} for that node.
	 *
	 * @param node the root node to start traversal from
	 * @param descend applied to each node; {@code false} prunes its subtree
	 */
	public static void walk(SparqlNode node, Predicate<SparqlNode> descend) {
		if (node == null) {
			return;
		}
		if (descend.test(node)) {
			for (SparqlNode child : node.children()) {
				walk(child, descend);
			}
		}
	}

	/**
	 * Walks a list of trees in order, each in pre-order.
	 */
	public static void walkAll(List<? extends SparqlNode> nodes, Consumer<SparqlNode> action) {
		if (nodes == null) {
			return;
		}
		for (SparqlNode node : nodes) {
			walkPreOrder(node, action);
		}
	}
}
