package org.javai.sparql.triples;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeWalker;
import org.javai.sparql.grammar.TriplesSameSubject;
import org.javai.sparql.grammar.TriplesSameSubjectPath;

/**
 * Collects the triple patterns embedded anywhere beneath a node.
 *
 * <p>The walk follows {@link SparqlNode#children()} depth first, so it
 * reaches triples nested under OPTIONAL, UNION, MINUS, GRAPH, SERVICE,
 * EXISTS and sub-selects. A collected triple is not searched further.
 * Duplicates are dropped by structural equality; the returned sets iterate in
 * order of first encounter.</p>
 */
public final class TripleCollector {

	private TripleCollector() {
		// Utility class - no instantiation
	}

	/**
	 * The distinct graph pattern triples beneath {@code node}, including
	 * {@code node} itself.
	 */
	public static Set<TriplesSameSubjectPath> collectTriples(SparqlNode node) {
		return collect(node, TriplesSameSubjectPath.class);
	}

	/**
	 * The distinct template triples beneath {@code node}: those of CONSTRUCT
	 * templates and update quads.
	 */
	public static Set<TriplesSameSubject> collectTemplateTriples(SparqlNode node) {
		return collect(node, TriplesSameSubject.class);
	}

	private static <T extends SparqlNode> Set<T> collect(SparqlNode node, Class<T> type) {
		Set<T> triples = new LinkedHashSet<>();
		SparqlNodeWalker.walk(node, current -> {
			if (type.isInstance(current)) {
				triples.add(type.cast(current));
				return false;
			}
			return true;
		});
		return Collections.unmodifiableSet(triples);
	}
}
