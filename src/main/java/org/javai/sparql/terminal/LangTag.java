package org.javai.sparql.terminal;

/**
 * A language tag such as {@code en-GB}. The raw value excludes the {@code @}.
 */
public record LangTag(String raw) implements Terminal {

	public LangTag {
		Lexicon.standard().require(LexicalRule.LANGTAG, raw);
	}

	@Override
	public LexicalRule rule() {
		return LexicalRule.LANGTAG;
	}

	@Override
	public String render() {
		return "@" + raw;
	}
}
