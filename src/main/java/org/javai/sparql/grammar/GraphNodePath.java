package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

/**
 * Subject or object of a triple in a graph pattern, where property paths are allowed.
 */
public sealed interface GraphNodePath extends SparqlNode permits VarOrTerm, TriplesNodePath {
}
