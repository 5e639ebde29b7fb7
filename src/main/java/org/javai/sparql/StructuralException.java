package org.javai.sparql;

/**
 * Exception thrown when a node is constructed with children that violate a
 * cardinality or pairing rule of its grammar production.
 *
 * <p>Construction is fail-fast: a node that throws this exception is never
 * created, so every reachable node is structurally valid.</p>
 */
public class StructuralException extends RuntimeException {

	private final String production;

	public StructuralException(String production, String message) {
		super(production + ": " + message);
		this.production = production;
	}

	/**
	 * The grammar production whose construction failed.
	 */
	public String production() {
		return production;
	}
}
