package org.javai.sparql.terminal;

/**
 * An integer, decimal or double token with an optional explicit sign.
 */
public sealed interface NumericToken extends Terminal permits IntegerToken, DecimalToken, DoubleToken {

	Sign sign();

	/**
	 * The same number with the given sign.
	 */
	NumericToken withSign(Sign sign);

	default boolean isSigned() {
		return sign() != Sign.NONE;
	}

	@Override
	default String render() {
		return sign().symbol() + raw();
	}
}
