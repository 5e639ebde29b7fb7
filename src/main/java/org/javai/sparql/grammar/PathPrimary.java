package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

public sealed interface PathPrimary extends SparqlNode
	permits Iri, RdfTypeKeyword, PathNegatedPropertySet, GroupedPath {
}
