package org.javai.sparql.grammar;

public enum AdditiveOperator {
	PLUS("+"),
	MINUS("-");

	private final String symbol;

	AdditiveOperator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
