package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

/**
 * Predicate position of a graph pattern triple: a property path or a variable.
 */
public sealed interface PathVerb extends SparqlNode permits PathAlternative, Var {
}
