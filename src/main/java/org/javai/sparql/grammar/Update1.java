package org.javai.sparql.grammar;

import org.javai.sparql.SparqlNode;

/**
 * A single update operation.
 */
public sealed interface Update1 extends SparqlNode
	permits Load, Clear, Drop, Add, Move, Copy, Create, InsertData, DeleteData, DeleteWhere, Modify {
}
