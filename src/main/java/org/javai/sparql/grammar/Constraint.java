package org.javai.sparql.grammar;

/**
 * The condition of a FILTER or HAVING, or an undirected ORDER BY condition.
 */
public sealed interface Constraint extends OrderCondition permits BrackettedExpression, BuiltInCall, FunctionCall {
}
