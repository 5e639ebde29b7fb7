package org.javai.sparql.terminal;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A parsed lexical rule catalog: one compiled pattern per {@link LexicalRule}.
 */
public record LexicalRuleSet(
	String version,
	Map<LexicalRule, Pattern> patterns,
	Map<LexicalRule, String> descriptions
) {

	public LexicalRuleSet {
		patterns = Collections.unmodifiableMap(copy(patterns));
		descriptions = Collections.unmodifiableMap(copy(descriptions));
		for (LexicalRule rule : LexicalRule.values()) {
			if (!patterns.containsKey(rule)) {
				throw new LexicalException("Lexical catalog has no pattern for rule " + rule);
			}
		}
	}

	public Pattern pattern(LexicalRule rule) {
		return patterns.get(rule);
	}

	private static <V> Map<LexicalRule, V> copy(Map<LexicalRule, V> source) {
		Map<LexicalRule, V> copy = new EnumMap<>(LexicalRule.class);
		if (source != null) {
			copy.putAll(source);
		}
		return copy;
	}
}
