package org.javai.sparql.terminal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.Level;
import org.javai.sparql.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link LexicalRulesParser}.
 */
class LexicalRulesParserTest {

	private final LexicalRulesParser parser = new LexicalRulesParser();

	/**
	 * A complete catalog accepting anything, with one rule overridden.
	 */
	static String catalogWith(String ruleName, String pattern) {
		StringBuilder yaml = new StringBuilder("lexicon_version: \"test\"\nrules:\n");
		for (LexicalRule rule : LexicalRule.values()) {
			String rulePattern = rule.name().equals(ruleName) ? pattern : "'.*'";
			yaml.append("  ").append(rule.name()).append(":\n");
			yaml.append("    pattern: ").append(rulePattern).append("\n");
		}
		return yaml.toString();
	}

	@Test
	void parsesVersionPatternsAndDescriptions() {
		String yaml = """
			lexicon_version: "2.0"
			fragments:
			  DIGIT: '[0-9]'
			rules:
			""" + rulesSection("INTEGER", "'${DIGIT}+'", "Digits only");

		LexicalRuleSet rules = parser.parseString(yaml);

		assertThat(rules.version()).isEqualTo("2.0");
		assertThat(rules.pattern(LexicalRule.INTEGER).pattern()).isEqualTo("(?:[0-9])+");
		assertThat(rules.descriptions()).containsEntry(LexicalRule.INTEGER, "Digits only");
	}

	@Test
	void expandsNestedFragments() {
		String yaml = """
			lexicon_version: "1"
			fragments:
			  LOWER: '[a-z]'
			  WORD: '${LOWER}+'
			rules:
			""" + rulesSection("LANGTAG", "'${WORD}(-${WORD})*'", null);

		Lexicon lexicon = Lexicon.of(parser.parseString(yaml));

		assertThat(lexicon.matches(LexicalRule.LANGTAG, "en-gb")).isTrue();
		assertThat(lexicon.matches(LexicalRule.LANGTAG, "en-GB")).isFalse();
	}

	@Test
	void unknownFragmentIsRejected() {
		String yaml = catalogWith("INTEGER", "'${NOPE}'");

		assertThatThrownBy(() -> parser.parseString(yaml))
			.isInstanceOf(LexicalException.class)
			.hasMessageContaining("${NOPE}");
	}

	@Test
	void selfReferencingFragmentIsRejected() {
		String yaml = """
			lexicon_version: "1"
			fragments:
			  A: 'x${B}'
			  B: 'y${A}'
			""" + catalogWith("INTEGER", "'${A}'").replace("lexicon_version: \"test\"\n", "");

		assertThatThrownBy(() -> parser.parseString(yaml))
			.isInstanceOf(LexicalException.class)
			.hasMessageContaining("refers to itself");
	}

	@Test
	void missingRulesSectionIsRejected() {
		assertThatThrownBy(() -> parser.parseString("lexicon_version: \"1\"\n"))
			.isInstanceOf(LexicalException.class)
			.hasMessage("Missing required 'rules' section");
	}

	@Test
	void emptyCatalogIsRejected() {
		assertThatThrownBy(() -> parser.parseString(""))
			.isInstanceOf(LexicalException.class)
			.hasMessage("Lexical catalog is empty");
	}

	@Test
	void unknownRuleNameIsRejected() {
		String yaml = catalogWith("INTEGER", "'[0-9]+'") + "  HEXADECIMAL:\n    pattern: '[0-9a-f]+'\n";

		assertThatThrownBy(() -> parser.parseString(yaml))
			.isInstanceOf(LexicalException.class)
			.hasMessageContaining("HEXADECIMAL");
	}

	@Test
	void ruleWithoutPatternIsRejected() {
		String yaml = catalogWith("INTEGER", "'[0-9]+'").replace("  WS:\n    pattern: '.*'\n",
			"  WS:\n    description: \"no pattern\"\n");

		assertThatThrownBy(() -> parser.parseString(yaml))
			.isInstanceOf(LexicalException.class)
			.hasMessage("Rule 'WS' has no 'pattern'");
	}

	@Test
	void incompleteCatalogIsRejected() {
		String yaml = """
			lexicon_version: "1"
			rules:
			  INTEGER:
			    pattern: '[0-9]+'
			""";

		assertThatThrownBy(() -> parser.parseString(yaml))
			.isInstanceOf(LexicalException.class);
	}

	@Test
	void invalidRegexIsRejected() {
		assertThatThrownBy(() -> parser.parseString(catalogWith("DECIMAL", "'[0-9'")))
			.isInstanceOf(LexicalException.class)
			.hasMessageContaining("Invalid pattern for rule DECIMAL");
	}

	@Test
	void malformedYamlIsWrapped() {
		assertThatThrownBy(() -> parser.parseString("rules: [unclosed"))
			.isInstanceOf(LexicalException.class)
			.hasMessageContaining("Failed to parse lexical catalog from string")
			.hasCauseInstanceOf(Exception.class);
	}

	@Test
	void malformedYamlNamesItsSource() {
		byte[] bytes = "rules: [unclosed".getBytes(StandardCharsets.UTF_8);

		assertThatThrownBy(() -> parser.parse(new ByteArrayInputStream(bytes)))
			.isInstanceOf(LexicalException.class)
			.hasMessage("Failed to parse lexical catalog from input stream");
		assertThatThrownBy(() -> parser.parse(new StringReader("rules: [unclosed")))
			.isInstanceOf(LexicalException.class)
			.hasMessage("Failed to parse lexical catalog from reader");
	}

	@Test
	void invalidCatalogFromPathKeepsItsOwnMessage(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("empty-rules.yml");
		Files.writeString(file, "lexicon_version: \"1\"\n");

		assertThatThrownBy(() -> parser.parse(file))
			.isInstanceOf(LexicalException.class)
			.hasMessageContaining("Missing required 'rules' section");
	}

	@Test
	void readsFromPathStreamAndReader(@TempDir Path dir) throws IOException {
		String yaml = catalogWith("INTEGER", "'[0-9]+'");
		Path file = dir.resolve("rules.yml");
		Files.writeString(file, yaml);

		LexicalRuleSet fromPath = parser.parse(file);
		LexicalRuleSet fromStream = parser.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
		LexicalRuleSet fromReader = parser.parse(new StringReader(yaml));

		assertThat(fromPath.version()).isEqualTo("test");
		assertThat(fromStream.pattern(LexicalRule.INTEGER).pattern()).isEqualTo("[0-9]+");
		assertThat(fromReader.pattern(LexicalRule.INTEGER).pattern()).isEqualTo("[0-9]+");
	}

	@Test
	void missingFileIsReportedWithPath(@TempDir Path dir) {
		Path missing = dir.resolve("missing.yml");

		assertThatThrownBy(() -> parser.parse(missing))
			.isInstanceOf(LexicalException.class)
			.hasMessageContaining("missing.yml");
	}

	@Test
	void logsParsedCatalogAtDebug() {
		try (LogCaptorAppender captor = LogCaptorAppender.capture(LexicalRulesParser.class)) {
			parser.parseString(catalogWith("INTEGER", "'[0-9]+'"));

			assertThat(captor.messagesAt(Level.DEBUG))
				.contains("Parsed lexical catalog version test with 14 rules and 0 fragments");
		}
	}

	private static String rulesSection(String ruleName, String pattern, String description) {
		String full = catalogWith(ruleName, pattern);
		String rules = full.substring(full.indexOf("rules:\n") + "rules:\n".length());
		if (description == null) {
			return rules;
		}
		String marker = "  " + ruleName + ":\n";
		return rules.replace(marker, marker + "    description: \"" + description + "\"\n");
	}
}
