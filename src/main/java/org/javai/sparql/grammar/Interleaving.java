package org.javai.sparql.grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * Orders two interleaved sequences the way they are written: the first
 * primary element, then each secondary element followed by the next
 * primary element while one remains.
 */
public final class Interleaving {

	private Interleaving() {
		// Utility class - no instantiation
	}

	/**
	 * A step of an interleaved sequence: a secondary element and the primary
	 * element that follows it, which may be {@code null}.
	 */
	public record Step<P, S>(S secondary, P following) {
	}

	public static <P, S> List<Step<P, S>> steps(List<P> primary, List<S> secondary) {
		List<Step<P, S>> steps = new ArrayList<>(secondary.size());
		for (int i = 0; i < secondary.size(); i++) {
			P following = i + 1 < primary.size() ? primary.get(i + 1) : null;
			steps.add(new Step<>(secondary.get(i), following));
		}
		return steps;
	}

	static List<Object> order(List<?> primary, List<?> secondary) {
		List<Object> ordered = new ArrayList<>(primary.size() + secondary.size());
		ordered.add(primary.get(0));
		for (int i = 0; i < secondary.size(); i++) {
			ordered.add(secondary.get(i));
			if (i + 1 < primary.size()) {
				ordered.add(primary.get(i + 1));
			}
		}
		return ordered;
	}
}
