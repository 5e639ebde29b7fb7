package org.javai.sparql.grammar;

public enum PathMod {
	ZERO_OR_ONE("?"),
	ZERO_OR_MORE("*"),
	ONE_OR_MORE("+");

	private final String symbol;

	PathMod(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
