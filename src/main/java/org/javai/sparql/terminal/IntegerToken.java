package org.javai.sparql.terminal;

import java.util.Objects;

public record IntegerToken(String raw, Sign sign) implements NumericToken {

	public IntegerToken {
		Objects.requireNonNull(sign, "sign");
		Lexicon.standard().require(LexicalRule.INTEGER, raw);
	}

	public IntegerToken(String raw) {
		this(raw, Sign.NONE);
	}

	/**
	 * An unsigned token for a non-negative value, a {@link Sign#MINUS} token
	 * otherwise.
	 */
	public static IntegerToken of(long value) {
		String digits = Long.toString(value);
		if (value < 0) {
			return new IntegerToken(digits.substring(1), Sign.MINUS);
		}
		return new IntegerToken(digits, Sign.NONE);
	}

	@Override
	public IntegerToken withSign(Sign sign) {
		return new IntegerToken(raw, sign);
	}

	@Override
	public LexicalRule rule() {
		return LexicalRule.INTEGER;
	}
}
