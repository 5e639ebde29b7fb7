package org.javai.sparql;

import java.util.List;
import java.util.Set;
import org.javai.sparql.grammar.TriplesSameSubjectPath;
import org.javai.sparql.render.SparqlRenderer;
import org.javai.sparql.triples.TripleCollector;

/**
 * A node of the SPARQL syntax tree.
 *
 * Every grammar production is modelled by exactly one node type. Nodes are
 * immutable once constructed and own their children exclusively, so a tree
 * can be rendered or traversed from several threads at once.
 */
public interface SparqlNode {

	/**
	 * Accepts a visitor and dispatches to the visitor method for this node type.
	 *
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	<R> R accept(SparqlNodeVisitor<R> visitor);

	/**
	 * The direct children of this node in source order. Absent optional parts
	 * are skipped, so the list never contains {@code null}.
	 */
	List<SparqlNode> children();

	/**
	 * The canonical SPARQL text of this node.
	 */
	default String render() {
		return SparqlRenderer.render(this);
	}

	/**
	 * The text fragments whose concatenation is {@link #render()}. Each call to
	 * {@code iterator()} renders the node afresh.
	 */
	default Iterable<String> fragments() {
		return () -> SparqlRenderer.fragments(this).iterator();
	}

	/**
	 * The distinct triple patterns found anywhere beneath this node.
	 */
	default Set<TriplesSameSubjectPath> collectTriples() {
		return TripleCollector.collectTriples(this);
	}

	/**
	 * The grammar production this node stands for.
	 */
	default String production() {
		return getClass().getSimpleName();
	}
}
