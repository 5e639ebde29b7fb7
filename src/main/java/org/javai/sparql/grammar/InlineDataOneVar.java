package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code ?x { v1 v2 }}. The value list may be empty.
 */
public record InlineDataOneVar(Var var, List<DataBlockValue> values) implements DataBlock {

	public InlineDataOneVar {
		Nodes.require(var, "var");
		values = Nodes.copy("InlineDataOneVar", values);
	}

	public static InlineDataOneVar of(Var var, DataBlockValue... values) {
		return new InlineDataOneVar(var, List.of(values));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitInlineDataOneVar(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(var, values);
	}
}
