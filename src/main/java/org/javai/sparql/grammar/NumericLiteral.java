package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.terminal.IntegerToken;
import org.javai.sparql.terminal.NumericToken;

public record NumericLiteral(NumericToken token) implements GraphTerm, PrimaryExpression, DataBlockValue {

	public NumericLiteral {
		Nodes.require(token, "token");
	}

	public static NumericLiteral of(long value) {
		return new NumericLiteral(IntegerToken.of(value));
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitNumericLiteral(this);
	}

	@Override
	public List<SparqlNode> children() {
		return List.of(token);
	}
}
