package org.javai.sparql.build;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.grammar.BlankNode;
import org.javai.sparql.grammar.BooleanLiteral;
import org.javai.sparql.grammar.BrackettedExpression;
import org.javai.sparql.grammar.BuiltInFunction;
import org.javai.sparql.grammar.BuiltInFunctionCall;
import org.javai.sparql.grammar.ComparisonOperator;
import org.javai.sparql.grammar.ConstructTriples;
import org.javai.sparql.grammar.Expression;
import org.javai.sparql.grammar.ExpressionList;
import org.javai.sparql.grammar.Filter;
import org.javai.sparql.grammar.Iri;
import org.javai.sparql.grammar.MembershipOperator;
import org.javai.sparql.grammar.NumericExpression;
import org.javai.sparql.grammar.NumericLiteral;
import org.javai.sparql.grammar.ObjectList;
import org.javai.sparql.grammar.ObjectListPath;
import org.javai.sparql.grammar.PathAlternative;
import org.javai.sparql.grammar.PathElt;
import org.javai.sparql.grammar.PathEltOrInverse;
import org.javai.sparql.grammar.PathSequence;
import org.javai.sparql.grammar.PathVerb;
import org.javai.sparql.grammar.PrimaryExpression;
import org.javai.sparql.grammar.PropertyListNotEmpty;
import org.javai.sparql.grammar.PropertyListPathNotEmpty;
import org.javai.sparql.grammar.RdfLiteral;
import org.javai.sparql.grammar.RdfTypeKeyword;
import org.javai.sparql.grammar.RelationalExpression;
import org.javai.sparql.grammar.TriplesBlock;
import org.javai.sparql.grammar.TriplesSameSubject;
import org.javai.sparql.grammar.TriplesSameSubjectPath;
import org.javai.sparql.grammar.TriplesTemplate;
import org.javai.sparql.grammar.Var;
import org.javai.sparql.grammar.VarOrTerm;
import org.javai.sparql.grammar.Verb;

/**
 * Helpers that assemble the minimal tree for common constructs. Each helper
 * returns exactly the tree that would be built by hand from the same
 * operands.
 *
 * <p>Supported operands:</p>
 * <ul>
 *   <li>triple subjects: {@link Var}, {@link Iri}, {@link BlankNode}</li>
 *   <li>triple predicates: {@link Var}, {@link Iri}, {@link RdfTypeKeyword}</li>
 *   <li>triple objects: {@link Var}, {@link Iri}, {@link BlankNode}, {@link RdfLiteral},
 *       {@link NumericLiteral}, {@link BooleanLiteral}</li>
 *   <li>filter operands: any {@link PrimaryExpression}</li>
 * </ul>
 * Anything else fails with {@link UnsupportedOperandException}.
 */
public final class SparqlBuilders {

	private SparqlBuilders() {
		// Utility class - no instantiation
	}

	/**
	 * {@code subject predicate object} as a template triple.
	 */
	public static TriplesSameSubject triple(VarOrTerm subject, Verb predicate, VarOrTerm object) {
		checkSubject("triple", subject);
		checkObject("triple", object);
		return new TriplesSameSubject(subject,
			PropertyListNotEmpty.of(requirePredicate("triple", predicate), ObjectList.of(object)));
	}

	/**
	 * {@code subject predicate object} as a graph pattern triple. An IRI or
	 * {@code a} predicate becomes a single-step property path.
	 */
	public static TriplesSameSubjectPath triplePath(VarOrTerm subject, Verb predicate, VarOrTerm object) {
		checkSubject("triplePath", subject);
		checkObject("triplePath", object);
		return new TriplesSameSubjectPath(subject,
			PropertyListPathNotEmpty.of(pathVerb(requirePredicate("triplePath", predicate)), ObjectListPath.of(object)));
	}

	/**
	 * The minimal expression chain around a primary expression.
	 */
	public static Expression expression(PrimaryExpression primary) {
		requireOperand("expression", primary);
		return Expression.of(primary);
	}

	/**
	 * {@code left op right} for a comparison operator.
	 */
	public static Expression comparison(PrimaryExpression left, ComparisonOperator operator,
			PrimaryExpression right) {
		requireOperand("comparison", left);
		requireOperand("comparison", right);
		return Expression.of(new RelationalExpression(NumericExpression.of(left),
			new RelationalExpression.Comparison(operator, NumericExpression.of(right))));
	}

	/**
	 * {@code left IN (a, b)} or {@code left NOT IN (a, b)}.
	 */
	public static Expression membership(PrimaryExpression left, MembershipOperator operator,
			List<? extends PrimaryExpression> members) {
		requireOperand("membership", left);
		if (members == null) {
			throw new UnsupportedOperandException("ExpressionList", "membership: " + operator.keyword()
				+ " needs a list of operands");
		}
		List<Expression> expressions = new ArrayList<>(members.size());
		for (PrimaryExpression member : members) {
			requireOperand("membership", member);
			expressions.add(Expression.of(member));
		}
		return Expression.of(new RelationalExpression(NumericExpression.of(left),
			new RelationalExpression.Membership(operator, new ExpressionList(expressions))));
	}

	/**
	 * {@code FILTER (focus op comparator)} for one of {@code = != < > <= >=}.
	 *
	 * @throws UnsupportedOperandException for {@code IN} and {@code NOT IN},
	 * which need a list of operands, and for unknown operators
	 */
	public static Filter filterRelational(PrimaryExpression focus, String operator, PrimaryExpression comparator) {
		Optional<ComparisonOperator> comparison = ComparisonOperator.fromSymbol(operator);
		if (comparison.isEmpty()) {
			if (MembershipOperator.fromKeyword(operator).isPresent()) {
				throw new UnsupportedOperandException(production(comparator), "filterRelational: " + operator
					+ " needs a list of operands, got a single " + production(comparator));
			}
			throw new UnsupportedOperandException(production(comparator),
				"filterRelational: unsupported operator '" + operator + "'");
		}
		return new Filter(new BrackettedExpression(comparison(focus, comparison.get(), comparator)));
	}

	/**
	 * {@code FILTER (focus IN (a, b))} or {@code FILTER (focus NOT IN (a, b))}.
	 *
	 * @throws UnsupportedOperandException for operators other than {@code IN}
	 * and {@code NOT IN}
	 */
	public static Filter filterRelational(PrimaryExpression focus, String operator,
			List<? extends PrimaryExpression> comparators) {
		Optional<MembershipOperator> membership = MembershipOperator.fromKeyword(operator);
		if (membership.isEmpty()) {
			throw new UnsupportedOperandException("ExpressionList", "filterRelational: operator '" + operator
				+ "' takes a single operand, not a list");
		}
		return new Filter(new BrackettedExpression(membership(focus, membership.get(), comparators)));
	}

	/**
	 * {@code FUNCTION(a, b)} for a built-in function.
	 */
	public static BuiltInFunctionCall builtIn(BuiltInFunction function, PrimaryExpression... args) {
		List<Expression> expressions = new ArrayList<>(args.length);
		for (PrimaryExpression arg : args) {
			requireOperand("builtIn", arg);
			expressions.add(Expression.of(arg));
		}
		return new BuiltInFunctionCall(function, expressions);
	}

	/**
	 * The triples in the given order as one block.
	 */
	public static TriplesBlock triplesBlock(List<TriplesSameSubjectPath> triples) {
		return TriplesBlock.of(triples);
	}

	public static ConstructTriples constructTriples(List<TriplesSameSubject> triples) {
		return ConstructTriples.of(triples);
	}

	public static TriplesTemplate triplesTemplate(List<TriplesSameSubject> triples) {
		return TriplesTemplate.of(triples);
	}

	/**
	 * Concatenates the parts, in order, into new construct triples. The parts
	 * are not modified. Returns {@code null} for no parts.
	 */
	public static ConstructTriples mergeConstructTriples(List<ConstructTriples> parts) {
		ConstructTriples merged = null;
		for (ConstructTriples part : parts) {
			merged = merged == null ? part : append(merged, part);
		}
		return merged;
	}

	private static ConstructTriples append(ConstructTriples head, ConstructTriples tail) {
		List<TriplesSameSubject> rest = new ArrayList<>(head.rest());
		rest.addAll(tail.items());
		return new ConstructTriples(head.first(), rest);
	}

	private static PathVerb pathVerb(Verb predicate) {
		if (predicate instanceof Var var) {
			return var;
		}
		if (predicate instanceof Iri iri) {
			return PathAlternative.of(iri);
		}
		return PathAlternative.of(PathSequence.of(new PathEltOrInverse(false, new PathElt(RdfTypeKeyword.A, null))));
	}

	private static Verb requirePredicate(String helper, Verb predicate) {
		if (predicate == null) {
			throw new UnsupportedOperandException("null", helper + ": predicate is required");
		}
		return predicate;
	}

	private static void checkSubject(String helper, VarOrTerm subject) {
		if (!(subject instanceof Var || subject instanceof Iri || subject instanceof BlankNode)) {
			throw new UnsupportedOperandException(production(subject), helper + ": unsupported subject "
				+ production(subject) + "; expected Var, Iri or BlankNode");
		}
	}

	private static void checkObject(String helper, VarOrTerm object) {
		if (!(object instanceof Var || object instanceof Iri || object instanceof BlankNode
				|| object instanceof RdfLiteral || object instanceof NumericLiteral
				|| object instanceof BooleanLiteral)) {
			throw new UnsupportedOperandException(production(object), helper + ": unsupported object "
				+ production(object) + "; expected Var, Iri, BlankNode or a literal");
		}
	}

	private static void requireOperand(String helper, PrimaryExpression operand) {
		if (operand == null) {
			throw new UnsupportedOperandException("null", helper + ": operand is required");
		}
	}

	private static String production(Object operand) {
		if (operand instanceof SparqlNode node) {
			return node.production();
		}
		return "null";
	}
}
