package org.javai.sparql.grammar;

/**
 * A call to a SPARQL built-in: a plain function, an aggregate, or one of the
 * built-ins with dedicated syntax.
 */
public sealed interface BuiltInCall extends Constraint, PrimaryExpression, GroupCondition
	permits Aggregate, BuiltInFunctionCall, BoundCall, RegexExpression, SubstringExpression,
	StrReplaceExpression, ExistsFunc, NotExistsFunc {
}
