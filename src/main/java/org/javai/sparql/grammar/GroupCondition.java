package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

public sealed interface GroupCondition extends SparqlNode permits BuiltInCall, FunctionCall, GroupBinding, Var {
}
