package org.javai.sparql.grammar;

public enum UnaryOperator {
	NOT("!"),
	PLUS("+"),
	MINUS("-");

	private final String symbol;

	UnaryOperator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
