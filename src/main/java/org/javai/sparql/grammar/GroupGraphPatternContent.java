package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

/**
 * What a {@code { ... }} group contains: a sub-select or a sequence of
 * triples blocks and other patterns.
 */
public sealed interface GroupGraphPatternContent extends SparqlNode permits SubSelect, GroupGraphPatternSub {
}
