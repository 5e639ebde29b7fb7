package org.javai.sparql.terminal;

public enum VarSigil {
	QUESTION("?"),
	DOLLAR("$");

	private final String symbol;

	VarSigil(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
