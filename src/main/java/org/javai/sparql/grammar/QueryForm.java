package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

public sealed interface QueryForm extends SparqlNode
	permits SelectQuery, ConstructQuery, ConstructWhereQuery, DescribeQuery, AskQuery {
}
