package org.javai.sparql.terminal;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for lexical rule catalogs written in YAML.
 *
 * <p>A catalog declares reusable {@code fragments} and one entry per
 * {@link LexicalRule} under {@code rules}. A {@code ${NAME}} reference inside a
 * fragment or rule pattern is replaced by the named fragment, wrapped in a
 * non-capturing group.</p>
 */
public class LexicalRulesParser {

	private static final Logger logger = LoggerFactory.getLogger(LexicalRulesParser.class);

	private static final Pattern REFERENCE = Pattern.compile("\\$\\{([A-Za-z0-9_]+)}");

	private final Yaml yaml = new Yaml();

	/**
	 * Parse a lexical catalog from a path.
	 */
	public LexicalRuleSet parse(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return load(() -> yaml.load(reader), "path: " + path);
		} catch (IOException e) {
			throw new LexicalException("Cannot read lexical catalog from path: " + path, e);
		}
	}

	public LexicalRuleSet parse(InputStream inputStream) {
		return load(() -> yaml.load(inputStream), "input stream");
	}

	public LexicalRuleSet parse(Reader reader) {
		return load(() -> yaml.load(reader), "reader");
	}

	public LexicalRuleSet parseString(String yamlContent) {
		return load(() -> yaml.load(yamlContent), "string");
	}

	/**
	 * Reads the YAML document and builds the rule set. Any failure other than
	 * a {@link LexicalException} is reported against {@code source}.
	 */
	private LexicalRuleSet load(Supplier<Map<String, Object>> document, String source) {
		try {
			return buildRuleSet(document.get());
		} catch (LexicalException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new LexicalException("Failed to parse lexical catalog from " + source, e);
		}
	}

	@SuppressWarnings("unchecked")
	private LexicalRuleSet buildRuleSet(Map<String, Object> data) {
		if (data == null) {
			throw new LexicalException("Lexical catalog is empty");
		}
		Object versionObj = data.get("lexicon_version");
		String version = versionObj instanceof String
			? (String) versionObj
			: String.valueOf(versionObj);

		Map<String, Object> fragmentsMap = (Map<String, Object>) data.get("fragments");
		Map<String, String> fragments = new LinkedHashMap<>();
		if (fragmentsMap != null) {
			fragmentsMap.forEach((name, value) -> fragments.put(name, String.valueOf(value)));
		}

		Map<String, Object> rulesMap = (Map<String, Object>) data.get("rules");
		if (rulesMap == null) {
			throw new LexicalException("Missing required 'rules' section");
		}

		Map<LexicalRule, Pattern> patterns = new EnumMap<>(LexicalRule.class);
		Map<LexicalRule, String> descriptions = new EnumMap<>(LexicalRule.class);
		for (Map.Entry<String, Object> entry : rulesMap.entrySet()) {
			LexicalRule rule = ruleNamed(entry.getKey());
			if (!(entry.getValue() instanceof Map)) {
				throw new LexicalException("Rule '" + entry.getKey() + "' must be a mapping with a 'pattern'");
			}
			Map<String, Object> ruleData = (Map<String, Object>) entry.getValue();
			Object pattern = ruleData.get("pattern");
			if (pattern == null) {
				throw new LexicalException("Rule '" + entry.getKey() + "' has no 'pattern'");
			}
			String expanded = expand(String.valueOf(pattern), fragments, new HashSet<>());
			patterns.put(rule, compile(rule, expanded));
			Object description = ruleData.get("description");
			if (description != null) {
				descriptions.put(rule, String.valueOf(description));
			}
		}

		logger.debug("Parsed lexical catalog version {} with {} rules and {} fragments",
			version, patterns.size(), fragments.size());
		return new LexicalRuleSet(version, patterns, descriptions);
	}

	private LexicalRule ruleNamed(String name) {
		try {
			return LexicalRule.valueOf(name);
		} catch (IllegalArgumentException e) {
			throw new LexicalException("Unknown lexical rule '" + name + "'", e);
		}
	}

	private String expand(String pattern, Map<String, String> fragments, Set<String> expanding) {
		Matcher matcher = REFERENCE.matcher(pattern);
		StringBuilder result = new StringBuilder();
		while (matcher.find()) {
			String name = matcher.group(1);
			String fragment = fragments.get(name);
			if (fragment == null) {
				throw new LexicalException("Unknown fragment reference '${" + name + "}'");
			}
			if (!expanding.add(name)) {
				throw new LexicalException("Fragment '" + name + "' refers to itself");
			}
			String replacement = "(?:" + expand(fragment, fragments, expanding) + ")";
			expanding.remove(name);
			matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
		}
		matcher.appendTail(result);
		return result.toString();
	}

	private Pattern compile(LexicalRule rule, String regex) {
		try {
			return Pattern.compile(regex);
		} catch (PatternSyntaxException e) {
			throw new LexicalException("Invalid pattern for rule " + rule + ": " + e.getDescription(), e);
		}
	}
}
