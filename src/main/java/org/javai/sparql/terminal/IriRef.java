package org.javai.sparql.terminal;

/**
 * An IRI reference, rendered between angle brackets.
 */
public record IriRef(String raw) implements IriToken {

	public IriRef {
		Lexicon.standard().require(LexicalRule.IRIREF, raw);
	}

	@Override
	public LexicalRule rule() {
		return LexicalRule.IRIREF;
	}

	@Override
	public String render() {
		return "<" + raw + ">";
	}
}
