package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

public sealed interface PrologueDecl extends SparqlNode permits BaseDecl, PrefixDecl {
}
