package org.javai.sparql.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.terminal.Terminal;

/**
 * Emits a JSON view of a syntax tree: each node's production and its children.
 * The root carries the rendered text of the whole tree; terminals carry their
 * lexical rule, raw value and text. Intended for debugging and for tools that
 * inspect generated queries.
 */
public final class SparqlNodeJsonEmitter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private SparqlNodeJsonEmitter() {}

	public static ObjectNode emit(SparqlNode node) {
		ObjectNode json = tree(node);
		json.put("text", node.render());
		return json;
	}

	// Inner nodes omit "text": it would repeat each subtree once per ancestor.
	private static ObjectNode tree(SparqlNode node) {
		ObjectNode json = mapper.createObjectNode();
		json.put("production", node.production());
		if (node instanceof Terminal terminal) {
			json.put("terminal", terminal.rule().name());
			json.put("raw", terminal.raw());
			json.put("text", terminal.render());
			return json;
		}
		if (node instanceof Enum<?> keyword) {
			json.put("keyword", keyword.name());
		}
		ArrayNode children = json.putArray("children");
		node.children().forEach(child -> children.add(tree(child)));
		return json;
	}

	/**
	 * The pretty-printed JSON of {@link #emit(SparqlNode)}.
	 */
	public static String toJson(SparqlNode node) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(emit(node));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to write JSON for " + node.production(), e);
		}
	}
}
