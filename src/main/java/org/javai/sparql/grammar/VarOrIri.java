package org.javai.sparql.grammar;

public sealed interface VarOrIri extends Verb permits Var, Iri {
}
