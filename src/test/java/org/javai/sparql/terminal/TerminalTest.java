package org.javai.sparql.terminal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

/**
 * Tests for terminal tokens: validation against the standard lexicon and the
 * delimiters each token adds when rendered.
 */
class TerminalTest {

	@Test
	void iriRefRendersBetweenAngleBrackets() {
		assertThat(new IriRef("http://example.org/a").render()).isEqualTo("<http://example.org/a>");
		assertThat(new IriRef("").render()).isEqualTo("<>");
	}

	@Test
	void iriRefRejectsSpacesAndBrackets() {
		assertThatThrownBy(() -> new IriRef("http://example.org/a b"))
			.isInstanceOf(LexicalException.class)
			.hasMessageContaining("IRIREF")
			.hasMessageContaining("http://example.org/a b");
		assertThatThrownBy(() -> new IriRef("<http://example.org/>"))
			.isInstanceOf(LexicalException.class);
	}

	@Test
	void prefixedNamesKeepTheirColon() {
		assertThat(new PnameLn("foaf:name").render()).isEqualTo("foaf:name");
		assertThat(new PnameLn(":local").render()).isEqualTo(":local");
		assertThat(new PnameNs("foaf").render()).isEqualTo("foaf:");
		assertThat(new PnameNs("").render()).isEqualTo(":");
	}

	@Test
	void prefixedNameWithoutColonIsRejected() {
		assertThatThrownBy(() -> new PnameLn("name"))
			.isInstanceOf(LexicalException.class)
			.hasMessageContaining("PNAME_LN");
		assertThatThrownBy(() -> new PnameNs("foaf:"))
			.isInstanceOf(LexicalException.class);
	}

	@Test
	void variablesRenderWithTheirSigil() {
		assertThat(new VarToken("name").render()).isEqualTo("?name");
		assertThat(new VarToken("name", VarSigil.DOLLAR).render()).isEqualTo("$name");
		assertThat(new VarToken("name")).isNotEqualTo(new VarToken("name", VarSigil.DOLLAR));
	}

	@Test
	void variableNameMustNotIncludeTheSigil() {
		assertThatThrownBy(() -> new VarToken("?name"))
			.isInstanceOf(LexicalException.class)
			.hasMessageContaining("VARNAME");
		assertThatThrownBy(() -> new VarToken(""))
			.isInstanceOf(LexicalException.class);
	}

	@Test
	void nullRawIsRejected() {
		assertThatThrownBy(() -> new VarToken(null))
			.isInstanceOf(LexicalException.class);
	}

	@Test
	void blankNodesAndEmptyDelimiters() {
		assertThat(new BlankNodeLabel("b0").render()).isEqualTo("_:b0");
		assertThat(new Anon().render()).isEqualTo("[]");
		assertThat(new Anon(" ").render()).isEqualTo("[ ]");
		assertThat(new Nil().render()).isEqualTo("()");

		assertThatThrownBy(() -> new Nil("x")).isInstanceOf(LexicalException.class);
	}

	@Test
	void languageTagRendersWithAt() {
		assertThat(new LangTag("en-GB").render()).isEqualTo("@en-GB");
		assertThatThrownBy(() -> new LangTag("@en")).isInstanceOf(LexicalException.class);
	}

	@Test
	void numericTokensPrefixTheirSign() {
		assertThat(new IntegerToken("42").render()).isEqualTo("42");
		assertThat(new IntegerToken("42", Sign.PLUS).render()).isEqualTo("+42");
		assertThat(new DecimalToken("3.14", Sign.MINUS).render()).isEqualTo("-3.14");
		assertThat(new DoubleToken("1.0e3").render()).isEqualTo("1.0e3");
	}

	@Test
	void integerTokenFromNegativeValueCarriesMinusSign() {
		IntegerToken token = IntegerToken.of(-5);

		assertThat(token.raw()).isEqualTo("5");
		assertThat(token.sign()).isEqualTo(Sign.MINUS);
		assertThat(token.isSigned()).isTrue();
		assertThat(token.render()).isEqualTo("-5");
	}

	@Test
	void numericRawMustBeUnsigned() {
		assertThatThrownBy(() -> new IntegerToken("-5")).isInstanceOf(LexicalException.class);
		assertThatThrownBy(() -> new DecimalToken("3")).isInstanceOf(LexicalException.class);
		assertThatThrownBy(() -> new DoubleToken("1.5")).isInstanceOf(LexicalException.class);
	}

	@Test
	void withSignKeepsTheDigits() {
		NumericToken signed = new DecimalToken("0.5").withSign(Sign.MINUS);

		assertThat(signed).isEqualTo(new DecimalToken("0.5", Sign.MINUS));
		assertThat(signed.render()).isEqualTo("-0.5");
	}

	@Test
	void stringTokensRenderBodyVerbatimBetweenQuotes() {
		assertThat(new StringToken("chat").render()).isEqualTo("\"chat\"");
		assertThat(new StringToken("it\\'s", Quote.SINGLE).render()).isEqualTo("'it\\'s'");
		assertThat(new StringToken("line1\nline2", Quote.LONG_DOUBLE).render())
			.isEqualTo("\"\"\"line1\nline2\"\"\"");
		assertThat(new StringToken("say \"hi\"", Quote.LONG_SINGLE).render())
			.isEqualTo("'''say \"hi\"'''");
	}

	@Test
	void shortStringRejectsUnescapedQuoteAndNewline() {
		assertThatThrownBy(() -> new StringToken("say \"hi\""))
			.isInstanceOf(LexicalException.class)
			.hasMessageContaining("STRING_LITERAL2");
		assertThatThrownBy(() -> new StringToken("a\nb", Quote.SINGLE))
			.isInstanceOf(LexicalException.class)
			.hasMessageContaining("STRING_LITERAL1");
	}

	@Test
	void escapedStringEscapesQuotesBackslashesAndLineBreaks() {
		StringToken token = StringToken.escaped("a \"b\"\\c\n\td");

		assertThat(token.raw()).isEqualTo("a \\\"b\\\"\\\\c\\n\\td");
		assertThat(token.quote()).isEqualTo(Quote.DOUBLE);
		assertThat(token.render()).isEqualTo("\"a \\\"b\\\"\\\\c\\n\\td\"");
	}

	@Test
	void terminalsHaveNoChildrenAndReportTheirRule() {
		VarToken token = new VarToken("x");

		assertThat(token.children()).isEmpty();
		assertThat(token.rule()).isEqualTo(LexicalRule.VARNAME);
		assertThat(token.production()).isEqualTo("VarToken");
		assertThat(new StringToken("x", Quote.LONG_SINGLE).rule()).isEqualTo(LexicalRule.STRING_LITERAL_LONG1);
	}

	@Test
	void tokensAreEqualByValue() {
		assertThat(new IriRef("http://example.org/")).isEqualTo(new IriRef("http://example.org/"));
		assertThat(new IriRef("http://example.org/").hashCode())
			.isEqualTo(new IriRef("http://example.org/").hashCode());
		assertThat(new StringToken("x")).isNotEqualTo(new StringToken("x", Quote.SINGLE));
	}
}
