package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.StructuralException;

/**
 * A subject with its property list, as found in templates and quads.
 * A term or variable subject needs a property list; a collection or blank
 * node property list may stand alone.
 */
public record TriplesSameSubject(GraphNode subject, PropertyListNotEmpty properties) implements SparqlNode {

	public TriplesSameSubject {
		Nodes.require(subject, "subject");
		if (subject instanceof VarOrTerm && properties == null) {
			throw new StructuralException("TriplesSameSubject", "a variable or term subject needs a property list");
		}
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitTriplesSameSubject(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(subject, properties);
	}
}
