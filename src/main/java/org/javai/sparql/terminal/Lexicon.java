package org.javai.sparql.terminal;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates raw tokens against the patterns of a {@link LexicalRuleSet}.
 * Matching is anchored: the whole raw string must match the rule.
 */
public final class Lexicon {

	private static final Logger logger = LoggerFactory.getLogger(Lexicon.class);

	static final String STANDARD_RESOURCE = "META-INF/sparql-lexical-rules.yml";

	private final LexicalRuleSet rules;

	private Lexicon(LexicalRuleSet rules) {
		this.rules = Objects.requireNonNull(rules, "rules");
	}

	/**
	 * The lexicon built from the bundled SPARQL 1.1 catalog. Loaded on first use.
	 */
	public static Lexicon standard() {
		return StandardHolder.INSTANCE;
	}

	public static Lexicon of(LexicalRuleSet rules) {
		return new Lexicon(rules);
	}

	public LexicalRuleSet rules() {
		return rules;
	}

	public boolean matches(LexicalRule rule, String raw) {
		if (raw == null) {
			return false;
		}
		return rules.pattern(rule).matcher(raw).matches();
	}

	/**
	 * Returns {@code raw} unchanged when it matches {@code rule}.
	 *
	 * @throws LexicalException if the raw token is null or does not match
	 */
	public String require(LexicalRule rule, String raw) {
		if (!matches(rule, raw)) {
			String description = rules.descriptions().get(rule);
			throw new LexicalException("Invalid " + rule + ": '" + raw + "'"
				+ (description != null ? " (expected " + description.toLowerCase() + ")" : ""));
		}
		return raw;
	}

	public Pattern pattern(LexicalRule rule) {
		return rules.pattern(rule);
	}

	private static final class StandardHolder {
		private static final Lexicon INSTANCE = load();

		private static Lexicon load() {
			ClassLoader loader = Lexicon.class.getClassLoader();
			try (InputStream in = loader.getResourceAsStream(STANDARD_RESOURCE)) {
				if (in == null) {
					throw new LexicalException("Lexical catalog not found on classpath: " + STANDARD_RESOURCE);
				}
				LexicalRuleSet rules = new LexicalRulesParser().parse(in);
				logger.debug("Loaded standard lexicon version {} from {}", rules.version(), STANDARD_RESOURCE);
				return new Lexicon(rules);
			} catch (IOException e) {
				throw new LexicalException("Failed to read lexical catalog " + STANDARD_RESOURCE, e);
			}
		}
	}
}
