package org.javai.sparql.terminal;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * A leaf token of the syntax tree. The raw value of a terminal has been
 * matched against its lexical rule when the terminal was constructed, so
 * nodes holding a terminal never validate it again.
 */
public sealed interface Terminal extends SparqlNode
	permits IriToken, BlankNodeToken, NumericToken, VarToken, LangTag, StringToken, Nil {

	/**
	 * The raw token value without the delimiters the terminal renders itself.
	 */
	String raw();

	/**
	 * The surface form of the token, delimiters included.
	 */
	@Override
	String render();

	/**
	 * The lexical rule the raw value was validated against.
	 */
	LexicalRule rule();

	@Override
	default <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitTerminal(this);
	}

	@Override
	default List<SparqlNode> children() {
		return List.of();
	}
}
