package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * An IRI used as an expression, or an extension function call when an
 * argument list is present.
 */
public record IriOrFunction(Iri iri, ArgList args) implements PrimaryExpression {

	public IriOrFunction {
		Nodes.require(iri, "iri");
	}

	public static IriOrFunction of(Iri iri) {
		return new IriOrFunction(iri, null);
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitIriOrFunction(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(iri, args);
	}
}
