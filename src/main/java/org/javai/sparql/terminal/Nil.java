package org.javai.sparql.terminal;

/**
 * The empty list {@code ()}. The raw value is the whitespace between the
 * parentheses.
 */
public record Nil(String raw) implements Terminal {

	public Nil {
		Lexicon.standard().require(LexicalRule.WS, raw);
	}

	public Nil() {
		this("");
	}

	@Override
	public LexicalRule rule() {
		return LexicalRule.WS;
	}

	@Override
	public String render() {
		return "(" + raw + ")";
	}
}
