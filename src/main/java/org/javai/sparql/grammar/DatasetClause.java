package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

public sealed interface DatasetClause extends SparqlNode permits DefaultGraphClause, NamedGraphClause {

	Iri source();
}
