package org.javai.sparql.terminal;

/**
 * A prefixed name with a local part, as in {@code foaf:name}. The raw value
 * includes the colon.
 */
public record PnameLn(String raw) implements IriToken {

	public PnameLn {
		Lexicon.standard().require(LexicalRule.PNAME_LN, raw);
	}

	@Override
	public LexicalRule rule() {
		return LexicalRule.PNAME_LN;
	}

	@Override
	public String render() {
		return raw;
	}
}
