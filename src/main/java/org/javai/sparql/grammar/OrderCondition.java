package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

/**
 * An ORDER BY condition. Anything other than a {@link DirectedOrder} sorts
 * ascending and renders without a direction keyword.
 */
public sealed interface OrderCondition extends SparqlNode permits DirectedOrder, Constraint, Var {
}
