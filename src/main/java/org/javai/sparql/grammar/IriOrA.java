package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

/**
 * Member of a negated property set: an IRI or the {@code a} keyword.
 */
public sealed interface IriOrA extends SparqlNode permits Iri, RdfTypeKeyword {
}
