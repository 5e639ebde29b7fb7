package org.javai.sparql.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.StructuralException;
import org.javai.sparql.terminal.IntegerToken;
import org.javai.sparql.terminal.Sign;
import org.junit.jupiter.api.Test;

/**
 * Node construction rejects trees that break a cardinality or pairing rule of
 * the grammar.
 */
class StructuralInvariantTest {

	private static final Var S = Var.of("s");
	private static final Var P = Var.of("p");
	private static final Var O = Var.of("o");

	private static TriplesBlock block(String object) {
		return TriplesBlock.of(new TriplesSameSubjectPath(S,
			PropertyListPathNotEmpty.of(P, ObjectListPath.of(Var.of(object)))));
	}

	private static TriplesTemplate template(String object) {
		return TriplesTemplate.of(new TriplesSameSubject(S,
			PropertyListNotEmpty.of(P, ObjectList.of(Var.of(object)))));
	}

	private static GraphPatternNotTriples filter() {
		return new Filter(new BoundCall(O));
	}

	@Test
	void groupWithoutTriplesBlockIsRejected() {
		assertThatThrownBy(() -> new GroupGraphPatternSub(List.of(), List.of(filter())))
			.isInstanceOf(StructuralException.class)
			.hasMessage("GroupGraphPatternSub: at least one TriplesBlock is required")
			.extracting(e -> ((StructuralException) e).production())
			.isEqualTo("GroupGraphPatternSub");
	}

	@Test
	void blocksNeedPatternsBetweenThem() {
		List<TriplesBlock> blocks = List.of(block("a"), block("b"), block("c"));

		assertThatThrownBy(() -> new GroupGraphPatternSub(blocks, List.of(filter())))
			.isInstanceOf(StructuralException.class)
			.hasMessageContaining("3 TriplesBlock elements need at least 2 GraphPatternNotTriples elements")
			.hasMessageEndingWith("got 1");
	}

	@Test
	void singleBlockNeedsNoPattern() {
		assertThatCode(() -> new GroupGraphPatternSub(List.of(block("a")), List.of()))
			.doesNotThrowAnyException();
	}

	@Test
	void extraPatternsAfterLastBlockAreAllowed() {
		List<GraphPatternNotTriples> patterns = List.of(filter(), filter(), filter());

		assertThatCode(() -> new GroupGraphPatternSub(List.of(block("a"), block("b")), patterns))
			.doesNotThrowAnyException();
	}

	@Test
	void groupChildrenFollowTheWrittenOrder() {
		TriplesBlock first = block("a");
		TriplesBlock second = block("b");
		GraphPatternNotTriples between = filter();
		GraphPatternNotTriples trailing = new OptionalGraphPattern(GroupGraphPattern.of(block("c")));

		GroupGraphPatternSub sub = new GroupGraphPatternSub(List.of(first, second), List.of(between, trailing));

		assertThat(sub.children()).containsExactly(first, between, second, trailing);
	}

	@Test
	void quadsFollowTheSamePairingRule() {
		QuadsNotTriples graph = new QuadsNotTriples(Iri.of("http://example.org/g"), template("x"));

		assertThatThrownBy(() -> new Quads(List.of(), List.of(graph)))
			.isInstanceOf(StructuralException.class)
			.hasMessageStartingWith("Quads:");
		assertThatThrownBy(() -> new Quads(List.of(template("a"), template("b")), List.of()))
			.isInstanceOf(StructuralException.class);
		assertThatCode(() -> new Quads(List.of(template("a"), template("b")), List.of(graph)))
			.doesNotThrowAnyException();
	}

	@Test
	void interleavingStepsPairSecondaryWithFollowingPrimary() {
		List<Interleaving.Step<String, Integer>> steps = Interleaving.steps(List.of("a", "b"), List.of(1, 2));

		assertThat(steps).containsExactly(new Interleaving.Step<>(1, "b"), new Interleaving.Step<>(2, null));
	}

	@Test
	void nonEmptyListsRejectEmptyInput() {
		assertThatThrownBy(() -> ObjectList.of(List.of()))
			.isInstanceOf(StructuralException.class)
			.hasMessageStartingWith("ObjectList:");
		assertThatThrownBy(() -> TriplesBlock.of(List.of()))
			.isInstanceOf(StructuralException.class);
		assertThatThrownBy(() -> new Collection(List.of()))
			.isInstanceOf(StructuralException.class);
		assertThatThrownBy(() -> new OrderClause(List.of()))
			.isInstanceOf(StructuralException.class);
	}

	@Test
	void nullListElementsAreRejected() {
		List<GraphNode> items = new ArrayList<>(Arrays.asList(S, null));

		assertThatThrownBy(() -> new Collection(items))
			.isInstanceOf(StructuralException.class)
			.hasMessageContaining("must not be null");
	}

	@Test
	void listsAreCopiedOnConstruction() {
		List<SelectItem> items = new ArrayList<>(List.of(S));
		SelectClause select = new SelectClause(null, items);

		items.add(O);

		assertThat(select.items()).containsExactly(S);
		assertThatThrownBy(() -> select.items().add(P)).isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void distinctArgumentListNeedsArguments() {
		assertThatThrownBy(() -> new ArgList(true, List.of()))
			.isInstanceOf(StructuralException.class)
			.hasMessage("ArgList: DISTINCT needs at least one argument");
		assertThatCode(() -> new ArgList(false, List.of())).doesNotThrowAnyException();
	}

	@Test
	void builtInCallsCheckArity() {
		assertThatThrownBy(() -> BuiltInFunctionCall.of(BuiltInFunction.STRLEN))
			.isInstanceOf(StructuralException.class)
			.hasMessage("BuiltInFunctionCall: STRLEN takes 1 arguments, got 0");
		assertThatThrownBy(() -> BuiltInFunctionCall.of(BuiltInFunction.IF, Expression.of(S), Expression.of(O)))
			.isInstanceOf(StructuralException.class)
			.hasMessageContaining("IF takes 3 arguments, got 2");
		assertThatCode(() -> BuiltInFunctionCall.of(BuiltInFunction.CONCAT)).doesNotThrowAnyException();
		assertThatCode(() -> BuiltInFunctionCall.of(BuiltInFunction.NOW)).doesNotThrowAnyException();
	}

	@Test
	void literalCannotHaveLanguageAndDatatype() {
		assertThatThrownBy(() -> new RdfLiteral(RdfLiteral.of("x").value(),
				RdfLiteral.tagged("x", "en").language(), Iri.prefixed("xsd:string")))
			.isInstanceOf(StructuralException.class)
			.hasMessage("RdfLiteral: a literal cannot have both a language tag and a datatype");
	}

	@Test
	void valuesRowsMatchTheVariableCount() {
		List<Var> vars = List.of(S, O);
		DataBlockRow good = DataBlockRow.of(NumericLiteral.of(1), Undef.UNDEF);
		DataBlockRow bad = DataBlockRow.of(NumericLiteral.of(1));

		assertThatThrownBy(() -> new InlineDataFull(vars, List.of(good, bad)))
			.isInstanceOf(StructuralException.class)
			.hasMessage("InlineDataFull: row 1 has 1 values for 2 variables");
	}

	@Test
	void modifyNeedsDeleteOrInsert() {
		GroupGraphPattern where = GroupGraphPattern.of(block("o"));

		assertThatThrownBy(() -> new Modify(null, null, null, List.of(), where))
			.isInstanceOf(StructuralException.class)
			.hasMessage("Modify: a DELETE or an INSERT clause is required");
	}

	@Test
	void limitAndOffsetMustNotBeNegative() {
		assertThatThrownBy(() -> new LimitClause(-1))
			.isInstanceOf(StructuralException.class)
			.hasMessage("LimitClause: LIMIT must not be negative: -1");
		assertThatThrownBy(() -> new OffsetClause(-10))
			.isInstanceOf(StructuralException.class);
		assertThatThrownBy(() -> new LimitOffsetClauses(null, null))
			.isInstanceOf(StructuralException.class);
		assertThatCode(() -> new LimitClause(0)).doesNotThrowAnyException();
	}

	@Test
	void updateChainNeedsOperationsBeforeTheLast() {
		Update last = new Update(Prologue.empty(), new Clear(false, GraphRefAllKeyword.ALL), null);

		assertThatThrownBy(() -> new Update(Prologue.empty(), null, last))
			.isInstanceOf(StructuralException.class);
		assertThatCode(() -> new Update(Prologue.of(PrefixDecl.of("ex", "http://example.org/")), null, null))
			.doesNotThrowAnyException();
		assertThatThrownBy(() -> Update.of(List.of()))
			.isInstanceOf(StructuralException.class)
			.hasMessage("Update: at least one operation is required");
	}

	@Test
	void updateOfChainsOperationsInOrder() {
		Create create = new Create(false, new GraphRef(Iri.of("http://example.org/g")));
		Clear clear = new Clear(true, GraphRefAllKeyword.NAMED);

		Update update = Update.of(create, clear);

		assertThat(update.operation()).isEqualTo(create);
		assertThat(update.next().operation()).isEqualTo(clear);
		assertThat(update.next().next()).isNull();
		assertThat(update.operations()).containsExactly(create, clear);
	}

	@Test
	void signedLiteralStepNeedsSignedLiteral() {
		MultiplicativeExpression.Factor factor = new MultiplicativeExpression.Factor(MultiplicativeOperator.TIMES,
			new UnaryExpression(null, O));

		assertThatThrownBy(() -> new AdditiveExpression.SignedLiteralStep(NumericLiteral.of(2), List.of(factor)))
			.isInstanceOf(StructuralException.class)
			.hasMessageContaining("explicitly signed literal");
		assertThatCode(() -> new AdditiveExpression.SignedLiteralStep(
				new NumericLiteral(new IntegerToken("2", Sign.PLUS)), List.of(factor)))
			.doesNotThrowAnyException();
	}

	@Test
	void termSubjectNeedsPropertyList() {
		assertThatThrownBy(() -> new TriplesSameSubject(S, null))
			.isInstanceOf(StructuralException.class)
			.hasMessage("TriplesSameSubject: a variable or term subject needs a property list");
		assertThatThrownBy(() -> new TriplesSameSubjectPath(Iri.of("http://example.org/s"), null))
			.isInstanceOf(StructuralException.class);
	}

	@Test
	void blankNodePropertyListMayStandAlone() {
		BlankNodePropertyList subject = new BlankNodePropertyList(PropertyListNotEmpty.of(P, ObjectList.of(O)));

		TriplesSameSubject triple = new TriplesSameSubject(subject, null);

		assertThat(triple.children()).containsExactly(subject);
	}

	@Test
	void graphKeywordNeedsIri() {
		assertThatThrownBy(() -> new GraphOrDefault(null, true))
			.isInstanceOf(StructuralException.class);
		assertThat(GraphOrDefault.defaultGraph().isDefault()).isTrue();
		assertThat(GraphOrDefault.graph(Iri.of("http://example.org/g")).isDefault()).isFalse();
	}

	@Test
	void propertyListChildrenFlattenVerbsAndObjects() {
		ObjectList first = ObjectList.of(O);
		ObjectList second = ObjectList.of(S, O);
		PropertyListNotEmpty list = PropertyListNotEmpty.of(
			new PropertyListNotEmpty.Pair(P, first),
			new PropertyListNotEmpty.Pair(RdfTypeKeyword.A, second));

		List<SparqlNode> children = list.children();

		assertThat(children).containsExactly(P, first, RdfTypeKeyword.A, second);
	}

	@Test
	void structurallyEqualTreesAreEqual() {
		assertThat(block("a")).isEqualTo(block("a"));
		assertThat(block("a").hashCode()).isEqualTo(block("a").hashCode());
		assertThat(block("a")).isNotEqualTo(block("b"));
	}
}
