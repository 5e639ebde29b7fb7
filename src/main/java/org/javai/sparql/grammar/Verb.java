package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

/**
 * Predicate position of a template triple.
 */
public sealed interface Verb extends SparqlNode permits VarOrIri, RdfTypeKeyword {
}
