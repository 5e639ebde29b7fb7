package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

/**
 * A value in a VALUES block.
 */
public sealed interface DataBlockValue extends SparqlNode
	permits Iri, RdfLiteral, NumericLiteral, BooleanLiteral, Undef {
}
