package org.javai.sparql.grammar;

public sealed interface TriplesNode extends GraphNode permits Collection, BlankNodePropertyList {
}
