package org.javai.sparql.terminal;

/**
 * The delimiter of a string literal and the lexical rule its body must match.
 */
public enum Quote {
	SINGLE("'", LexicalRule.STRING_LITERAL1),
	DOUBLE("\"", LexicalRule.STRING_LITERAL2),
	LONG_SINGLE("'''", LexicalRule.STRING_LITERAL_LONG1),
	LONG_DOUBLE("\"\"\"", LexicalRule.STRING_LITERAL_LONG2);

	private final String delimiter;
	private final LexicalRule rule;

	Quote(String delimiter, LexicalRule rule) {
		this.delimiter = delimiter;
		this.rule = rule;
	}

	public String delimiter() {
		return delimiter;
	}

	public LexicalRule rule() {
		return rule;
	}
}
