package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

public sealed interface SelectItem extends SparqlNode permits Var, SelectBinding {
}
