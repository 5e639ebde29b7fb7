package org.javai.sparql.terminal;

import java.util.Objects;

/**
 * A variable name with its sigil. Two tokens naming the same variable with
 * different sigils are distinct tokens.
 */
public record VarToken(String raw, VarSigil sigil) implements Terminal {

	public VarToken {
		Objects.requireNonNull(sigil, "sigil");
		Lexicon.standard().require(LexicalRule.VARNAME, raw);
	}

	public VarToken(String raw) {
		this(raw, VarSigil.QUESTION);
	}

	@Override
	public LexicalRule rule() {
		return LexicalRule.VARNAME;
	}

	@Override
	public String render() {
		return sigil.symbol() + raw;
	}
}
