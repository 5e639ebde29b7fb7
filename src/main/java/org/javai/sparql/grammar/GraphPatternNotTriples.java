package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

public sealed interface GraphPatternNotTriples extends SparqlNode
	permits GroupOrUnionGraphPattern, OptionalGraphPattern, MinusGraphPattern, GraphGraphPattern,
	ServiceGraphPattern, Filter, Bind, InlineData {
}
