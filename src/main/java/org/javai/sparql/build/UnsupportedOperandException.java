package org.javai.sparql.build;

/**
 * Exception thrown when a builder helper receives an operand of a kind it
 * cannot place, or an operand shape that does not fit its operator.
 */
public class UnsupportedOperandException extends IllegalArgumentException {

	private final String production;

	public UnsupportedOperandException(String production, String message) {
		super(message);
		this.production = production;
	}

	/**
	 * The grammar production of the rejected operand.
	 */
	public String production() {
		return production;
	}
}
