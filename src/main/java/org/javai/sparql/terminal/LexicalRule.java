package org.javai.sparql.terminal;

/**
 * The lexical rules of the SPARQL 1.1 grammar that terminals are validated against.
 * Each constant names an entry under {@code rules} in the lexical catalog.
 */
public enum LexicalRule {
	IRIREF,
	PN_PREFIX,
	PNAME_LN,
	BLANK_NODE_LABEL,
	VARNAME,
	LANGTAG,
	INTEGER,
	DECIMAL,
	DOUBLE,
	STRING_LITERAL1,
	STRING_LITERAL2,
	STRING_LITERAL_LONG1,
	STRING_LITERAL_LONG2,
	WS
}
