package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;

public enum BooleanLiteral implements GraphTerm, PrimaryExpression, DataBlockValue {
	TRUE("true"),
	FALSE("false");

	private final String keyword;

	BooleanLiteral(String keyword) {
		this.keyword = keyword;
	}

	public static BooleanLiteral of(boolean value) {
		return value ? TRUE : FALSE;
	}

	public String keyword() {
		return keyword;
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitBooleanLiteral(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of();
	}
}
