package org.javai.sparql.grammar;

public sealed interface VarOrTerm extends GraphNode, GraphNodePath permits Var, GraphTerm {
}
