package org.javai.sparql.terminal;

import java.util.Objects;

public record DoubleToken(String raw, Sign sign) implements NumericToken {

	public DoubleToken {
		Objects.requireNonNull(sign, "sign");
		Lexicon.standard().require(LexicalRule.DOUBLE, raw);
	}

	public DoubleToken(String raw) {
		this(raw, Sign.NONE);
	}

	@Override
	public DoubleToken withSign(Sign sign) {
		return new DoubleToken(raw, sign);
	}

	@Override
	public LexicalRule rule() {
		return LexicalRule.DOUBLE;
	}
}
