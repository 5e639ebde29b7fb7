package org.javai.sparql.terminal;

/**
 * A prefix label followed by a colon, as in {@code foaf:}. The raw value is
 * the label alone and may be empty for the default prefix.
 */
public record PnameNs(String raw) implements IriToken {

	public PnameNs {
		Lexicon.standard().require(LexicalRule.PN_PREFIX, raw);
	}

	@Override
	public LexicalRule rule() {
		return LexicalRule.PN_PREFIX;
	}

	@Override
	public String render() {
		return raw + ":";
	}
}
