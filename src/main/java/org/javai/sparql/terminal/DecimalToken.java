package org.javai.sparql.terminal;

import java.util.Objects;

public record DecimalToken(String raw, Sign sign) implements NumericToken {

	public DecimalToken {
		Objects.requireNonNull(sign, "sign");
		Lexicon.standard().require(LexicalRule.DECIMAL, raw);
	}

	public DecimalToken(String raw) {
		this(raw, Sign.NONE);
	}

	@Override
	public DecimalToken withSign(Sign sign) {
		return new DecimalToken(raw, sign);
	}

	@Override
	public LexicalRule rule() {
		return LexicalRule.DECIMAL;
	}
}
