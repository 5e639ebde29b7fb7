package org.javai.sparql.testsupport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import org.apache.jena.query.Query;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.update.UpdateFactory;
import org.apache.jena.update.UpdateRequest;

/**
 * Checks rendered text with Apache Jena's SPARQL 1.1 parser, which knows
 * nothing about the tree that produced the text.
 */
public final class SparqlSyntaxAssertions {

	private SparqlSyntaxAssertions() {
	}

	/**
	 * Asserts that {@code sparql} parses as a SPARQL 1.1 query.
	 */
	public static Query assertCorrectQuerySyntax(String sparql) {
		try {
			Query query = QueryFactory.create(sparql);
			assertThat(query)
				.as("Rendered text should parse to a query: %s", sparql)
				.isNotNull();
			return query;
		} catch (Exception e) {
			return fail("Rendered query failed syntax validation: %s%nError: %s", sparql, e.getMessage(), e);
		}
	}

	/**
	 * Asserts that {@code sparql} parses as a SPARQL 1.1 update request.
	 */
	public static UpdateRequest assertCorrectUpdateSyntax(String sparql) {
		try {
			UpdateRequest request = UpdateFactory.create(sparql);
			assertThat(request.getOperations())
				.as("Rendered text should parse to update operations: %s", sparql)
				.isNotEmpty();
			return request;
		} catch (Exception e) {
			return fail("Rendered update failed syntax validation: %s%nError: %s", sparql, e.getMessage(), e);
		}
	}

	/**
	 * Asserts that the rendered query and a hand-written one parse to the same
	 * query, by comparing Jena's own serialization of each.
	 */
	public static void assertEquivalentQuery(String rendered, String expected) {
		Query actualQuery = assertCorrectQuerySyntax(rendered);
		Query expectedQuery = QueryFactory.create(expected);
		assertThat(actualQuery.serialize())
			.as("Rendered query should match %s", expected)
			.isEqualTo(expectedQuery.serialize());
	}
}
