package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A call to an extension function named by an IRI.
 */
public record FunctionCall(Iri iri, ArgList args) implements Constraint, GroupCondition {

	public FunctionCall {
		Nodes.require(iri, "iri");
		Nodes.require(args, "args");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitFunctionCall(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(iri, args);
	}
}
