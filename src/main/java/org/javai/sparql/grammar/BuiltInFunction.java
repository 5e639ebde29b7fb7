package org.javai.sparql.grammar;

/**
 * Built-in functions written as {@code KEYWORD(args)}, with the number of
 * arguments each accepts.
 */
public enum BuiltInFunction {
	STR("STR", 1, 1),
	LANG("LANG", 1, 1),
	LANGMATCHES("LANGMATCHES", 2, 2),
	DATATYPE("DATATYPE", 1, 1),
	IRI("IRI", 1, 1),
	URI("URI", 1, 1),
	BNODE("BNODE", 0, 1),
	RAND("RAND", 0, 0),
	ABS("ABS", 1, 1),
	CEIL("CEIL", 1, 1),
	FLOOR("FLOOR", 1, 1),
	ROUND("ROUND", 1, 1),
	CONCAT("CONCAT", 0, Integer.MAX_VALUE),
	STRLEN("STRLEN", 1, 1),
	UCASE("UCASE", 1, 1),
	LCASE("LCASE", 1, 1),
	ENCODE_FOR_URI("ENCODE_FOR_URI", 1, 1),
	CONTAINS("CONTAINS", 2, 2),
	STRSTARTS("STRSTARTS", 2, 2),
	STRENDS("STRENDS", 2, 2),
	STRBEFORE("STRBEFORE", 2, 2),
	STRAFTER("STRAFTER", 2, 2),
	YEAR("YEAR", 1, 1),
	MONTH("MONTH", 1, 1),
	DAY("DAY", 1, 1),
	HOURS("HOURS", 1, 1),
	MINUTES("MINUTES", 1, 1),
	SECONDS("SECONDS", 1, 1),
	TIMEZONE("TIMEZONE", 1, 1),
	TZ("TZ", 1, 1),
	NOW("NOW", 0, 0),
	UUID("UUID", 0, 0),
	STRUUID("STRUUID", 0, 0),
	MD5("MD5", 1, 1),
	SHA1("SHA1", 1, 1),
	SHA256("SHA256", 1, 1),
	SHA384("SHA384", 1, 1),
	SHA512("SHA512", 1, 1),
	COALESCE("COALESCE", 0, Integer.MAX_VALUE),
	IF("IF", 3, 3),
	STRLANG("STRLANG", 2, 2),
	STRDT("STRDT", 2, 2),
	SAME_TERM("sameTerm", 2, 2),
	IS_IRI("isIRI", 1, 1),
	IS_URI("isURI", 1, 1),
	IS_BLANK("isBLANK", 1, 1),
	IS_LITERAL("isLITERAL", 1, 1),
	IS_NUMERIC("isNUMERIC", 1, 1);

	private final String keyword;
	private final int minArity;
	private final int maxArity;

	BuiltInFunction(String keyword, int minArity, int maxArity) {
		this.keyword = keyword;
		this.minArity = minArity;
		this.maxArity = maxArity;
	}

	public String keyword() {
		return keyword;
	}

	public int minArity() {
		return minArity;
	}

	public int maxArity() {
		return maxArity;
	}

	public boolean accepts(int arity) {
		return arity >= minArity && arity <= maxArity;
	}
}
