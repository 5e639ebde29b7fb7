package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

/**
 * The body of a VALUES clause: one variable with a value list, or a
 * variable tuple with rows.
 */
public sealed interface DataBlock extends SparqlNode permits InlineDataOneVar, InlineDataFull {
}
