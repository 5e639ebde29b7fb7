package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.StructuralException;
import org.javai.sparql.terminal.LangTag;
import org.javai.sparql.terminal.StringToken;

/**
 * A string literal with an optional language tag or datatype, never both.
 */
public record RdfLiteral(StringToken value, LangTag language, Iri datatype)
		implements GraphTerm, PrimaryExpression, DataBlockValue {

	public RdfLiteral {
		Nodes.require(value, "value");
		if (language != null && datatype != null) {
			throw new StructuralException("RdfLiteral", "a literal cannot have both a language tag and a datatype");
		}
	}

	public RdfLiteral(StringToken value) {
		this(value, null, null);
	}

	/**
	 * A plain double-quoted literal for the given text, escaped as needed.
	 */
	public static RdfLiteral of(String text) {
		return new RdfLiteral(StringToken.escaped(text));
	}

	public static RdfLiteral tagged(String text, String language) {
		return new RdfLiteral(StringToken.escaped(text), new LangTag(language), null);
	}

	public static RdfLiteral typed(String text, Iri datatype) {
		return new RdfLiteral(StringToken.escaped(text), null, Nodes.require(datatype, "datatype"));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitRdfLiteral(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(value, language, datatype);
	}
}
