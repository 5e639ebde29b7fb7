package org.javai.sparql.grammar;

/**
 * A constant RDF term.
 */
public sealed interface GraphTerm extends VarOrTerm
	permits Iri, RdfLiteral, NumericLiteral, BooleanLiteral, BlankNode, NilTerm {
}
