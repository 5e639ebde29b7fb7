package org.javai.sparql.grammar;

import java.util.ArrayList;
import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * The verbs and objects of one subject, rendered as {@code v1 o1;v2 o2}.
 */
public record PropertyListNotEmpty(Pair first, List<Pair> rest) implements SparqlNode {

	/**
	 * A verb with its objects.
	 */
	public record Pair(Verb verb, ObjectList objects) {

		public Pair {
			Nodes.require(verb, "verb");
			Nodes.require(objects, "objects");
		}
	}

	public PropertyListNotEmpty {
		Nodes.require(first, "first");
		rest = Nodes.copy("PropertyListNotEmpty", rest);
	}

	public static PropertyListNotEmpty of(List<Pair> items) {
		return new PropertyListNotEmpty(Nodes.head("PropertyListNotEmpty", items), Nodes.tail(items));
	}

	public static PropertyListNotEmpty of(Pair first, Pair... rest) {
		return new PropertyListNotEmpty(first, List.of(rest));
	}

	public static PropertyListNotEmpty of(Verb verb, ObjectList objects) {
		return new PropertyListNotEmpty(new Pair(verb, objects), List.of());
	}

	public List<Pair> items() {
		return Nodes.items(first, rest);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitPropertyListNotEmpty(this);
	}

	@Override
	public List<SparqlNode> children() {
		List<SparqlNode> children = new ArrayList<>();
		for (Pair pair : items()) {
			children.add(pair.verb());
			children.add(pair.objects());
		}
		return List.copyOf(children);
	}
}
