package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

/**
 * Target of CLEAR and DROP: a named graph or one of DEFAULT, NAMED, ALL.
 */
public sealed interface GraphRefAll extends SparqlNode permits GraphRef, GraphRefAllKeyword {
}
