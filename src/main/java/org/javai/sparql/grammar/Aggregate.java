package org.javai.sparql.grammar;

/**
 * An aggregate call. Each variant carries exactly the fields its function
 * accepts, so {@code COUNT(*)} and {@code SEPARATOR} only exist where legal.
 */
public sealed interface Aggregate extends BuiltInCall permits CountAggregate, SimpleAggregate, GroupConcatAggregate {

	boolean distinct();
}
