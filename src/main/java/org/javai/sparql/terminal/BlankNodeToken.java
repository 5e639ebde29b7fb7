package org.javai.sparql.terminal;

/**
 * A token naming a blank node: a labelled blank node or an anonymous {@code []}.
 */
public sealed interface BlankNodeToken extends Terminal permits BlankNodeLabel, Anon {
}
