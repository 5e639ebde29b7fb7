package org.javai.sparql.grammar;

public enum OrderDirection {
	ASC,
	DESC
}
