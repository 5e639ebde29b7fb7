package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

/**
 * Subject or object of a triple in a template: a term, a variable, or a
 * collection/blank node property list.
 */
public sealed interface GraphNode extends SparqlNode permits VarOrTerm, TriplesNode {
}
