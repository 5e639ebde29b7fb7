package org.javai.sparql.terminal;

/**
 * The anonymous blank node {@code []}. The raw value is the whitespace between
 * the brackets.
 */
public record Anon(String raw) implements BlankNodeToken {

	public Anon {
		Lexicon.standard().require(LexicalRule.WS, raw);
	}

	public Anon() {
		this("");
	}

	@Override
	public LexicalRule rule() {
		return LexicalRule.WS;
	}

	@Override
	public String render() {
		return "[" + raw + "]";
	}
}
