package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

public sealed interface PrimaryExpression extends SparqlNode
	permits BrackettedExpression, BuiltInCall, IriOrFunction, RdfLiteral, NumericLiteral, BooleanLiteral, Var {
}
