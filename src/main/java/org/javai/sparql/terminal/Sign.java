package org.javai.sparql.terminal;

/**
 * Explicit sign of a numeric token.
 */
public enum Sign {
	NONE(""),
	PLUS("+"),
	MINUS("-");

	private final String symbol;

	Sign(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
