package org.javai.sparql.grammar;

import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.StructuralException;

public record BuiltInFunctionCall(BuiltInFunction function, List<Expression> args) implements BuiltInCall {

	public BuiltInFunctionCall {
		Nodes.require(function, "function");
		args = Nodes.copy("BuiltInFunctionCall", args);
		if (!function.accepts(args.size())) {
			throw new StructuralException("BuiltInFunctionCall", function.keyword() + " takes "
				+ arity(function) + " arguments, got " + args.size());
		}
	}

	public static BuiltInFunctionCall of(BuiltInFunction function, Expression... args) {
		return new BuiltInFunctionCall(function, List.of(args));
	}

	private static String arity(BuiltInFunction function) {
		if (function.minArity() == function.maxArity()) {
			return String.valueOf(function.minArity());
		}
		if (function.maxArity() == Integer.MAX_VALUE) {
			return "at least " + function.minArity();
		}
		return function.minArity() + " to " + function.maxArity();
	}

	@Override
	public <R> R accept(SparqlNodeVisitor<R> visitor) {
		return visitor.visitBuiltInFunctionCall(this);
	}

	@Override
	public List<SparqlNode> children() {
		return Nodes.children(args);
	}
}
