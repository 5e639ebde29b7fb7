package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public record DataBlockRow(List<DataBlockValue> values) implements SparqlNode {

	public DataBlockRow {
		values = Nodes.copy("DataBlockRow", values);
	}

	public static DataBlockRow of(DataBlockValue... values) {
		return new DataBlockRow(List.of(values));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitDataBlockRow(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(values);
	}
}
