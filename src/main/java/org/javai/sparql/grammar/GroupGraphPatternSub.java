package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * The body of a group: triples blocks interleaved with other patterns.
 *
 * <p>Triples block {@code i + 1} follows pattern {@code i}. Patterns beyond
 * the last block follow one another directly. There is at least one triples
 * block, and when there are {@code n > 1} blocks there are at least
 * {@code n - 1} patterns to separate them.</p>
 */
public record GroupGraphPatternSub(List<TriplesBlock> triplesBlocks, List<GraphPatternNotTriples> patterns)
		implements GroupGraphPatternContent {

	public GroupGraphPatternSub {
		triplesBlocks = Nodes.copy("GroupGraphPatternSub", triplesBlocks);
		patterns = Nodes.copy("GroupGraphPatternSub", patterns);
		Nodes.checkInterleaving("GroupGraphPatternSub", triplesBlocks.size(), patterns.size(),
			"TriplesBlock", "GraphPatternNotTriples");
	}

	public static GroupGraphPatternSub of(TriplesBlock block, GraphPatternNotTriples... patterns) {
		return new GroupGraphPatternSub(List.of(block), List.of(patterns));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitGroupGraphPatternSub(this);
	}

	/**
	 * Children in rendering order.
	 */
	@Override
	public List<SparqlNode> children() {
		return Nodes.children(Interleaving.order(triplesBlocks, patterns));
	}
}
