package org.javai.sparql.grammar;

import java.util.ArrayList;
import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * The verbs and objects of one subject in a graph pattern. Only the first
 * pair may hold path objects; later pairs take a plain object list.
 */
public record PropertyListPathNotEmpty(PathPair first, List<Pair> rest) implements SparqlNode {

	public record PathPair(PathVerb verb, ObjectListPath objects) {

		public PathPair {
			Nodes.require(verb, "verb");
			Nodes.require(objects, "objects");
		}
	}

	public record Pair(PathVerb verb, ObjectList objects) {

		public Pair {
			Nodes.require(verb, "verb");
			Nodes.require(objects, "objects");
		}
	}

	public PropertyListPathNotEmpty {
		Nodes.require(first, "first");
		rest = Nodes.copy("PropertyListPathNotEmpty", rest);
	}

	public static PropertyListPathNotEmpty of(PathVerb verb, ObjectListPath objects, Pair... rest) {
		return new PropertyListPathNotEmpty(new PathPair(verb, objects), List.of(rest));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitPropertyListPathNotEmpty(this);
	}

	@Override
	public List<SparqlNode> children() {
		List<SparqlNode> children = new ArrayList<>();
		children.add(first.verb());
		children.add(first.objects());
		for (Pair pair : rest) {
			children.add(pair.verb());
			children.add(pair.objects());
		}
		return List.copyOf(children);
	}
}
