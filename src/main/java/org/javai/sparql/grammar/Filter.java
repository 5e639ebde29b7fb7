package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record Filter(Constraint constraint) implements GraphPatternNotTriples {

	public Filter {
		Nodes.require(constraint, "constraint");
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitFilter(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(constraint);
	}
}
