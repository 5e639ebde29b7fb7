package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

/**
 * {@code LOAD [SILENT] <source> [INTO GRAPH <g>]}.
 */
public record Load(boolean silent, Iri source, GraphRef into) implements Update1 {

	public Load {
		Nodes.require(source, "source");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitLoad(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(source, into);
	}
}
