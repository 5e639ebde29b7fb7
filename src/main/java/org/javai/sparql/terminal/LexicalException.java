package org.javai.sparql.terminal;

/**
 * Exception thrown when a raw token does not match the lexical rule of its
 * terminal, or when a lexical rule catalog cannot be loaded.
 */
public class LexicalException extends RuntimeException {

	public LexicalException(String message) {
		super(message);
	}

	public LexicalException(String message, Throwable cause) {
		super(message, cause);
	}
}
