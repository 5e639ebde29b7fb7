package org.javai.sparql.grammar;

/**
 * Aggregates that take exactly one expression and no extra options.
 */
public enum AggregateFunction {
	SUM,
	MIN,
	MAX,
	AVG,
	SAMPLE
}
