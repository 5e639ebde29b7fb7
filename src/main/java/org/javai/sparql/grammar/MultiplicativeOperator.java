package org.javai.sparql.grammar;

public enum MultiplicativeOperator {
	TIMES("*"),
	DIVIDE("/");

	private final String symbol;

	MultiplicativeOperator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
