package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.StructuralException;

/**
 * A subject with its property list in a graph pattern. This is the unit the
 * triple collector deduplicates on.
 */
public record TriplesSameSubjectPath(GraphNodePath subject, PropertyListPathNotEmpty properties)
		implements SparqlNode {

	public TriplesSameSubjectPath {
		Nodes.require(subject, "subject");
		if (subject instanceof VarOrTerm && properties == null) {
			throw new StructuralException("TriplesSameSubjectPath", "a variable or term subject needs a property list");
		}
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitTriplesSameSubjectPath(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(subject, properties);
	}
}
