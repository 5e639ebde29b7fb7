package org.javai.sparql.terminal;

/**
 * A token naming an IRI: a full IRI reference or a prefixed name.
 */
public sealed interface IriToken extends Terminal permits IriRef, PnameLn, PnameNs {
}
