package org.javai.sparql.grammar;

public enum SelectModifier {
	DISTINCT,
	REDUCED
}
