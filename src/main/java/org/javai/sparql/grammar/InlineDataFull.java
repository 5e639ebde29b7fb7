package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.StructuralException;

/**
 * {@code (?a ?b) { (v1 v2) (UNDEF v3) }}. Every row has one value per variable.
 */
public record InlineDataFull(List<Var> vars, List<DataBlockRow> rows) implements DataBlock {

	public InlineDataFull {
		vars = Nodes.copy("InlineDataFull", vars);
		rows = Nodes.copy("InlineDataFull", rows);
		for (int i = 0; i < rows.size(); i++) {
			int width = rows.get(i).values().size();
			if (width != vars.size()) {
				throw new StructuralException("InlineDataFull", "row " + i + " has " + width
					+ " values for " + vars.size() + " variables");
			}
		}
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitInlineDataFull(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(vars, rows);
	}
}
