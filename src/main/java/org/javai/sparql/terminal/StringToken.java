package org.javai.sparql.terminal;

import java.util.Objects;

/**
 * A string literal body with its quote style. The body is kept exactly as
 * given, escapes included, and rendered between the quotes verbatim.
 */
public record StringToken(String raw, Quote quote) implements Terminal {

	public StringToken {
		Objects.requireNonNull(quote, "quote");
		Lexicon.standard().require(quote.rule(), raw);
	}

	public StringToken(String raw) {
		this(raw, Quote.DOUBLE);
	}

	/**
	 * A double-quoted token whose body is {@code text} with quotes, backslashes
	 * and line breaks escaped.
	 */
	public static StringToken escaped(String text) {
		Objects.requireNonNull(text, "text");
		StringBuilder body = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
				case '\\' -> body.append("\\\\");
				case '"' -> body.append("\\\"");
				case '\n' -> body.append("\\n");
				case '\r' -> body.append("\\r");
				case '\t' -> body.append("\\t");
				default -> body.append(c);
			}
		}
		return new StringToken(body.toString(), Quote.DOUBLE);
	}

	@Override
	public LexicalRule rule() {
		return quote.rule();
	}

	@Override
	public String render() {
		return quote.delimiter() + raw + quote.delimiter();
	}
}
