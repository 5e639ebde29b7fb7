package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * The {@code UNDEF} placeholder in a VALUES row.
 */
public enum Undef implements DataBlockValue {
	UNDEF;

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitUndef(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of();
	}
}
