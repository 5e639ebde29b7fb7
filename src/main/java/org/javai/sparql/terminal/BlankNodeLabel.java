package org.javai.sparql.terminal;

public record BlankNodeLabel(String raw) implements BlankNodeToken {

	public BlankNodeLabel {
		Lexicon.standard().require(LexicalRule.BLANK_NODE_LABEL, raw);
	}

	@Override
	public LexicalRule rule() {
		return LexicalRule.BLANK_NODE_LABEL;
	}

	@Override
	public String render() {
		return "_:" + raw;
	}
}
