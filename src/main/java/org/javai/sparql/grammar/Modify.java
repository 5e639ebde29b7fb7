package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.StructuralException;

/**
 * {@code [WITH <g>] DELETE {..} INSERT {..} USING .. WHERE {..}} with at least
 * one of the DELETE and INSERT clauses.
 */
public record Modify(Iri with, DeleteClause delete, InsertClause insert, List<UsingClause> using,
		GroupGraphPattern where) implements Update1 {

	public Modify {
		if (delete == null && insert == null) {
			throw new StructuralException("Modify", "a DELETE or an INSERT clause is required");
		}
		using = Nodes.copy("Modify", using);
		Nodes.require(where, "where");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitModify(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(with, delete, insert, using, where);
	}
}
