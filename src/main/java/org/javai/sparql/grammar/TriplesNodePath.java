package org.javai.sparql.grammar;

public sealed interface TriplesNodePath extends GraphNodePath permits CollectionPath, BlankNodePropertyListPath {
}
