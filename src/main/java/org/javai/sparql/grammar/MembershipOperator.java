package org.javai.sparql.grammar;

import java.util.Arrays;
import java.util.Optional;

public enum MembershipOperator {
	IN("IN"),
	NOT_IN("NOT IN");

	private final String keyword;

	MembershipOperator(String keyword) {
		this.keyword = keyword;
	}

	public String keyword() {
		return keyword;
	}

	/**
	 * Looks up an operator by keyword, ignoring case and the amount of
	 * whitespace in {@code NOT IN}.
	 */
	public static Optional<MembershipOperator> fromKeyword(String keyword) {
		if (keyword == null) {
			return Optional.empty();
		}
		String normalized = keyword.trim().replaceAll("\\s+", " ");
		return Arrays.stream(values())
			.filter(op -> op.keyword.equalsIgnoreCase(normalized))
			.findFirst();
	}
}
