package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A complete query: prologue, query form and an optional trailing VALUES clause.
 */
public record Query(Prologue prologue, QueryForm form, ValuesClause values) implements SparqlNode {

	public Query {
		Nodes.require(prologue, "prologue");
		Nodes.require(form, "form");
	}

	public static Query of(QueryForm form) {
		return new Query(Prologue.empty(), form, null);
	}

	public static Query of(Prologue prologue, QueryForm form) {
		return new Query(prologue, form, null);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitQuery(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(prologue, form, values);
	}
}
