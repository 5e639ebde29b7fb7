package org.javai.sparql.grammar;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.StructuralException;

/**
 * Construction helpers shared by the node records.
 */
final class Nodes {

	private Nodes() {
		// Utility class - no instantiation
	}

	/**
	 * Flattens the given parts into an immutable child list. Nulls are skipped,
	 * collections contribute their elements in order.
	 */
	static List<SparqlNode> children(Object... parts) {
		List<SparqlNode> children = new ArrayList<>();
		for (Object part : parts) {
			addChild(children, part);
		}
		return Collections.unmodifiableList(children);
	}

	private static void addChild(List<SparqlNode> children, Object part) {
		if (part == null) {
			return;
		}
		if (part instanceof SparqlNode node) {
			children.add(node);
		} else if (part instanceof Collection<?> collection) {
			for (Object element : collection) {
				addChild(children, element);
			}
		} else {
			throw new IllegalArgumentException("Not a node: " + part.getClass().getName());
		}
	}

	/**
	 * Immutable copy of an optional list; {@code null} becomes the empty list.
	 */
	static <T> List<T> copy(String production, List<? extends T> list) {
		if (list == null) {
			return List.of();
		}
		for (T element : list) {
			if (element == null) {
				throw new StructuralException(production, "list elements must not be null");
			}
		}
		return List.copyOf(list);
	}

	/**
	 * Immutable copy of a list that must hold at least one element.
	 */
	static <T> List<T> nonEmpty(String production, List<? extends T> list, String what) {
		if (list == null || list.isEmpty()) {
			throw new StructuralException(production, "at least one " + what + " is required");
		}
		return copy(production, list);
	}

	static <T> T head(String production, List<? extends T> items) {
		if (items == null || items.isEmpty()) {
			throw new StructuralException(production, "at least one element is required");
		}
		T head = items.get(0);
		if (head == null) {
			throw new StructuralException(production, "list elements must not be null");
		}
		return head;
	}

	static <T> List<T> tail(List<? extends T> items) {
		return List.copyOf(items.subList(1, items.size()));
	}

	static <T> List<T> items(T first, List<? extends T> rest) {
		List<T> items = new ArrayList<>(rest.size() + 1);
		items.add(first);
		items.addAll(rest);
		return Collections.unmodifiableList(items);
	}

	static <T> T require(T value, String name) {
		return Objects.requireNonNull(value, name);
	}

	/**
	 * Checks the pairing of interleaved sequences: at least one primary
	 * element, and at least {@code primary - 1} secondary elements when there
	 * is more than one primary element.
	 */
	static void checkInterleaving(String production, int primary, int secondary,
			String primaryName, String secondaryName) {
		if (primary < 1) {
			throw new StructuralException(production, "at least one " + primaryName + " is required");
		}
		if (primary > 1 && secondary < primary - 1) {
			throw new StructuralException(production, primary + " " + primaryName
				+ " elements need at least " + (primary - 1) + " " + secondaryName
				+ " elements between them, got " + secondary);
		}
	}
}
