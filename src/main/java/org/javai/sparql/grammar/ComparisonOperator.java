package org.javai.sparql.grammar;

import java.util.Arrays;
import java.util.Optional;

public enum ComparisonOperator {
	EQ("="),
	NE("!="),
	LT("<"),
	GT(">"),
	LE("<="),
	GE(">=");

	private final String symbol;

	ComparisonOperator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	public static Optional<ComparisonOperator> fromSymbol(String symbol) {
		return Arrays.stream(values())
			.filter(op -> op.symbol.equals(symbol))
			.findFirst();
	}
}
