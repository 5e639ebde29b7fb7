package org.javai.sparql.render;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.javai.sparql.SparqlNode;
import org.javai.sparql.SparqlNodeVisitor;
import org.javai.sparql.grammar.Add;
import org.javai.sparql.grammar.AdditiveExpression;
import org.javai.sparql.grammar.ArgList;
import org.javai.sparql.grammar.AskQuery;
import org.javai.sparql.grammar.BaseDecl;
import org.javai.sparql.grammar.Bind;
import org.javai.sparql.grammar.BlankNode;
import org.javai.sparql.grammar.BlankNodePropertyList;
import org.javai.sparql.grammar.BlankNodePropertyListPath;
import org.javai.sparql.grammar.BooleanLiteral;
import org.javai.sparql.grammar.BoundCall;
import org.javai.sparql.grammar.BrackettedExpression;
import org.javai.sparql.grammar.BuiltInFunctionCall;
import org.javai.sparql.grammar.Clear;
import org.javai.sparql.grammar.Collection;
import org.javai.sparql.grammar.CollectionPath;
import org.javai.sparql.grammar.ConditionalAndExpression;
import org.javai.sparql.grammar.ConditionalOrExpression;
import org.javai.sparql.grammar.ConstructQuery;
import org.javai.sparql.grammar.ConstructTemplate;
import org.javai.sparql.grammar.ConstructTriples;
import org.javai.sparql.grammar.ConstructWhereQuery;
import org.javai.sparql.grammar.Copy;
import org.javai.sparql.grammar.CountAggregate;
import org.javai.sparql.grammar.Create;
import org.javai.sparql.grammar.DataBlockRow;
import org.javai.sparql.grammar.DefaultGraphClause;
import org.javai.sparql.grammar.DeleteClause;
import org.javai.sparql.grammar.DeleteData;
import org.javai.sparql.grammar.DeleteWhere;
import org.javai.sparql.grammar.DescribeQuery;
import org.javai.sparql.grammar.DirectedOrder;
import org.javai.sparql.grammar.Drop;
import org.javai.sparql.grammar.ExistsFunc;
import org.javai.sparql.grammar.Expression;
import org.javai.sparql.grammar.ExpressionList;
import org.javai.sparql.grammar.Filter;
import org.javai.sparql.grammar.FunctionCall;
import org.javai.sparql.grammar.GraphGraphPattern;
import org.javai.sparql.grammar.GraphOrDefault;
import org.javai.sparql.grammar.GraphRef;
import org.javai.sparql.grammar.GraphRefAllKeyword;
import org.javai.sparql.grammar.GroupBinding;
import org.javai.sparql.grammar.GroupClause;
import org.javai.sparql.grammar.GroupConcatAggregate;
import org.javai.sparql.grammar.GroupGraphPattern;
import org.javai.sparql.grammar.GroupGraphPatternSub;
import org.javai.sparql.grammar.GroupOrUnionGraphPattern;
import org.javai.sparql.grammar.GroupedPath;
import org.javai.sparql.grammar.HavingClause;
import org.javai.sparql.grammar.InlineData;
import org.javai.sparql.grammar.InlineDataFull;
import org.javai.sparql.grammar.InlineDataOneVar;
import org.javai.sparql.grammar.InsertClause;
import org.javai.sparql.grammar.InsertData;
import org.javai.sparql.grammar.Interleaving;
import org.javai.sparql.grammar.Iri;
import org.javai.sparql.grammar.IriOrFunction;
import org.javai.sparql.grammar.LimitClause;
import org.javai.sparql.grammar.LimitOffsetClauses;
import org.javai.sparql.grammar.Load;
import org.javai.sparql.grammar.MinusGraphPattern;
import org.javai.sparql.grammar.Modify;
import org.javai.sparql.grammar.Move;
import org.javai.sparql.grammar.MultiplicativeExpression;
import org.javai.sparql.grammar.NamedGraphClause;
import org.javai.sparql.grammar.NilTerm;
import org.javai.sparql.grammar.NotExistsFunc;
import org.javai.sparql.grammar.NumericExpression;
import org.javai.sparql.grammar.NumericLiteral;
import org.javai.sparql.grammar.ObjectList;
import org.javai.sparql.grammar.ObjectListPath;
import org.javai.sparql.grammar.OffsetClause;
import org.javai.sparql.grammar.OptionalGraphPattern;
import org.javai.sparql.grammar.OrderClause;
import org.javai.sparql.grammar.PathAlternative;
import org.javai.sparql.grammar.PathElt;
import org.javai.sparql.grammar.PathEltOrInverse;
import org.javai.sparql.grammar.PathNegatedPropertySet;
import org.javai.sparql.grammar.PathOneInPropertySet;
import org.javai.sparql.grammar.PathSequence;
import org.javai.sparql.grammar.PrefixDecl;
import org.javai.sparql.grammar.Prologue;
import org.javai.sparql.grammar.PropertyListNotEmpty;
import org.javai.sparql.grammar.PropertyListPathNotEmpty;
import org.javai.sparql.grammar.QuadData;
import org.javai.sparql.grammar.QuadPattern;
import org.javai.sparql.grammar.Quads;
import org.javai.sparql.grammar.QuadsNotTriples;
import org.javai.sparql.grammar.Query;
import org.javai.sparql.grammar.QueryUnit;
import org.javai.sparql.grammar.RdfLiteral;
import org.javai.sparql.grammar.RdfTypeKeyword;
import org.javai.sparql.grammar.RegexExpression;
import org.javai.sparql.grammar.RelationalExpression;
import org.javai.sparql.grammar.SelectBinding;
import org.javai.sparql.grammar.SelectClause;
import org.javai.sparql.grammar.SelectQuery;
import org.javai.sparql.grammar.ServiceGraphPattern;
import org.javai.sparql.grammar.SimpleAggregate;
import org.javai.sparql.grammar.SolutionModifier;
import org.javai.sparql.grammar.StrReplaceExpression;
import org.javai.sparql.grammar.SubSelect;
import org.javai.sparql.grammar.SubstringExpression;
import org.javai.sparql.grammar.TriplesBlock;
import org.javai.sparql.grammar.TriplesSameSubject;
import org.javai.sparql.grammar.TriplesSameSubjectPath;
import org.javai.sparql.grammar.TriplesTemplate;
import org.javai.sparql.grammar.UnaryExpression;
import org.javai.sparql.grammar.Undef;
import org.javai.sparql.grammar.Update;
import org.javai.sparql.grammar.UpdateUnit;
import org.javai.sparql.grammar.UsingClause;
import org.javai.sparql.grammar.ValueLogical;
import org.javai.sparql.grammar.ValuesClause;
import org.javai.sparql.grammar.Var;
import org.javai.sparql.grammar.WhereClause;
import org.javai.sparql.terminal.Terminal;

/**
 * Renders SPARQL syntax trees to canonical query and update text.
 *
 * <p>Rendering produces a lazy stream of text fragments. A child is only
 * visited when the stream reaches it, and each call to {@link #fragments}
 * starts a fresh traversal, so the same tree may be rendered any number of
 * times from any number of threads.</p>
 *
 * <p>Layout: prologue declarations end with a newline; the clauses of a query
 * form and of a DELETE/INSERT operation start on their own line; group graph
 * patterns render on one line as {@code { ... }}; update operations are
 * separated by {@code " ;\n"}.</p>
 */
public final class SparqlRenderer implements SparqlNodeVisitor<Stream<String>> {

	private static final SparqlRenderer INSTANCE = new SparqlRenderer();

	private SparqlRenderer() {
	}

	/**
	 * The canonical text of {@code node}.
	 */
	public static String render(SparqlNode node) {
		return fragments(node).collect(Collectors.joining());
	}

	/**
	 * The text fragments of {@code node}, produced on demand.
	 */
	public static Stream<String> fragments(SparqlNode node) {
		return INSTANCE.r(node);
	}

	// Stream helpers

	private Stream<String> r(SparqlNode node) {
		return Stream.of(node).flatMap(n -> n.accept(this));
	}

	private static Stream<String> s(String text) {
		return Stream.of(text);
	}

	@SafeVarargs
	private static Stream<String> cat(Stream<String>... parts) {
		return Stream.of(parts).flatMap(Function.identity());
	}

	private Stream<String> join(List<? extends SparqlNode> nodes, String separator) {
		return IntStream.range(0, nodes.size()).boxed()
			.flatMap(i -> i == 0 ? r(nodes.get(i)) : Stream.concat(s(separator), r(nodes.get(i))));
	}

	/**
	 * {@code prefix} followed by the node, or nothing when the node is absent.
	 */
	private Stream<String> opt(String prefix, SparqlNode node) {
		return node == null ? Stream.empty() : cat(s(prefix), r(node));
	}

	private Stream<String> each(String prefix, List<? extends SparqlNode> nodes) {
		return nodes.stream().flatMap(n -> cat(s(prefix), r(n)));
	}

	private static Stream<String> keyword(boolean present, String text) {
		return present ? s(text) : Stream.empty();
	}

	private Stream<String> interleaved(List<? extends SparqlNode> primary, List<? extends SparqlNode> secondary) {
		return cat(r(primary.get(0)),
			Interleaving.steps(primary, secondary).stream()
				.flatMap(step -> cat(s(" "), r(step.secondary()), opt(" . ", step.following()))));
	}

	@Override
	public Stream<String> visitTerminal(Terminal terminal) {
		return s(terminal.render());
	}

	// Query

	@Override
	public Stream<String> visitQueryUnit(QueryUnit node) {
		return r(node.query());
	}

	@Override
	public Stream<String> visitQuery(Query node) {
		return cat(r(node.prologue()), r(node.form()), opt("\n", node.values()));
	}

	@Override
	public Stream<String> visitPrologue(Prologue node) {
		return node.declarations().stream().flatMap(d -> cat(r(d), s("\n")));
	}

	@Override
	public Stream<String> visitBaseDecl(BaseDecl node) {
		return cat(s("BASE "), r(node.iri()));
	}

	@Override
	public Stream<String> visitPrefixDecl(PrefixDecl node) {
		return cat(s("PREFIX "), r(node.prefix()), s(" "), r(node.iri()));
	}

	@Override
	public Stream<String> visitSelectQuery(SelectQuery node) {
		return cat(r(node.select()), each("\n", node.datasets()), s("\n"), r(node.where()), r(node.modifier()));
	}

	@Override
	public Stream<String> visitSubSelect(SubSelect node) {
		return cat(r(node.select()), s("\n"), r(node.where()), r(node.modifier()), opt("\n", node.values()));
	}

	@Override
	public Stream<String> visitSelectClause(SelectClause node) {
		return cat(s("SELECT"),
			node.modifier() == null ? Stream.empty() : s(" " + node.modifier().name()),
			node.selectsAll() ? s(" *") : each(" ", node.items()));
	}

	@Override
	public Stream<String> visitSelectBinding(SelectBinding node) {
		return cat(s("("), r(node.expression()), s(" AS "), r(node.var()), s(")"));
	}

	@Override
	public Stream<String> visitConstructQuery(ConstructQuery node) {
		return cat(s("CONSTRUCT "), r(node.template()), each("\n", node.datasets()), s("\n"), r(node.where()),
			r(node.modifier()));
	}

	@Override
	public Stream<String> visitConstructWhereQuery(ConstructWhereQuery node) {
		return cat(s("CONSTRUCT"), each("\n", node.datasets()), s("\nWHERE "), braced(node.template()),
			r(node.modifier()));
	}

	@Override
	public Stream<String> visitDescribeQuery(DescribeQuery node) {
		return cat(s("DESCRIBE"),
			node.targets().isEmpty() ? s(" *") : each(" ", node.targets()),
			each("\n", node.datasets()), opt("\n", node.where()), r(node.modifier()));
	}

	@Override
	public Stream<String> visitAskQuery(AskQuery node) {
		return cat(s("ASK"), each("\n", node.datasets()), s("\n"), r(node.where()), r(node.modifier()));
	}

	@Override
	public Stream<String> visitDefaultGraphClause(DefaultGraphClause node) {
		return cat(s("FROM "), r(node.source()));
	}

	@Override
	public Stream<String> visitNamedGraphClause(NamedGraphClause node) {
		return cat(s("FROM NAMED "), r(node.source()));
	}

	@Override
	public Stream<String> visitWhereClause(WhereClause node) {
		return cat(s("WHERE "), r(node.pattern()));
	}

	@Override
	public Stream<String> visitSolutionModifier(SolutionModifier node) {
		return cat(opt("\n", node.group()), opt("\n", node.having()), opt("\n", node.order()),
			opt("\n", node.limitOffset()));
	}

	@Override
	public Stream<String> visitGroupClause(GroupClause node) {
		return cat(s("GROUP BY "), join(node.conditions(), " "));
	}

	@Override
	public Stream<String> visitGroupBinding(GroupBinding node) {
		return cat(s("("), r(node.expression()), opt(" AS ", node.var()), s(")"));
	}

	@Override
	public Stream<String> visitHavingClause(HavingClause node) {
		return cat(s("HAVING "), join(node.conditions(), " "));
	}

	@Override
	public Stream<String> visitOrderClause(OrderClause node) {
		return cat(s("ORDER BY "), join(node.conditions(), " "));
	}

	@Override
	public Stream<String> visitDirectedOrder(DirectedOrder node) {
		return cat(s(node.direction().name()), r(node.expression()));
	}

	@Override
	public Stream<String> visitLimitOffsetClauses(LimitOffsetClauses node) {
		if (node.limit() == null) {
			return r(node.offset());
		}
		return cat(r(node.limit()), opt("\n", node.offset()));
	}

	@Override
	public Stream<String> visitLimitClause(LimitClause node) {
		return s("LIMIT " + node.limit());
	}

	@Override
	public Stream<String> visitOffsetClause(OffsetClause node) {
		return s("OFFSET " + node.offset());
	}

	@Override
	public Stream<String> visitValuesClause(ValuesClause node) {
		return cat(s("VALUES "), r(node.block()));
	}

	// Update

	@Override
	public Stream<String> visitUpdateUnit(UpdateUnit node) {
		return r(node.update());
	}

	/**
	 * Renders the request chain link by link rather than through
	 * {@link Update#next()}, so stack depth does not grow with the number of
	 * operations.
	 */
	@Override
	public Stream<String> visitUpdate(Update node) {
		return Stream.iterate(node, Objects::nonNull, Update::next)
			.flatMap(link -> cat(
				link == node ? Stream.empty() : s(" ;\n"),
				r(link.prologue()),
				opt("", link.operation())));
	}

	@Override
	public Stream<String> visitLoad(Load node) {
		return cat(s("LOAD"), keyword(node.silent(), " SILENT"), s(" "), r(node.source()),
			opt(" INTO ", node.into()));
	}

	@Override
	public Stream<String> visitClear(Clear node) {
		return cat(s("CLEAR"), keyword(node.silent(), " SILENT"), s(" "), r(node.target()));
	}

	@Override
	public Stream<String> visitDrop(Drop node) {
		return cat(s("DROP"), keyword(node.silent(), " SILENT"), s(" "), r(node.target()));
	}

	@Override
	public Stream<String> visitCreate(Create node) {
		return cat(s("CREATE"), keyword(node.silent(), " SILENT"), s(" "), r(node.graph()));
	}

	@Override
	public Stream<String> visitAdd(Add node) {
		return transfer("ADD", node.silent(), node.from(), node.to());
	}

	@Override
	public Stream<String> visitMove(Move node) {
		return transfer("MOVE", node.silent(), node.from(), node.to());
	}

	@Override
	public Stream<String> visitCopy(Copy node) {
		return transfer("COPY", node.silent(), node.from(), node.to());
	}

	private Stream<String> transfer(String operation, boolean silent, GraphOrDefault from, GraphOrDefault to) {
		return cat(s(operation), keyword(silent, " SILENT"), s(" "), r(from), s(" TO "), r(to));
	}

	@Override
	public Stream<String> visitInsertData(InsertData node) {
		return cat(s("INSERT DATA "), r(node.data()));
	}

	@Override
	public Stream<String> visitDeleteData(DeleteData node) {
		return cat(s("DELETE DATA "), r(node.data()));
	}

	@Override
	public Stream<String> visitDeleteWhere(DeleteWhere node) {
		return cat(s("DELETE WHERE "), r(node.pattern()));
	}

	@Override
	public Stream<String> visitModify(Modify node) {
		return cat(
			node.with() == null ? Stream.empty() : cat(s("WITH "), r(node.with()), s("\n")),
			node.delete() == null ? Stream.empty() : cat(r(node.delete()), s("\n")),
			node.insert() == null ? Stream.empty() : cat(r(node.insert()), s("\n")),
			node.using().stream().flatMap(u -> cat(r(u), s("\n"))),
			s("WHERE "), r(node.where()));
	}

	@Override
	public Stream<String> visitDeleteClause(DeleteClause node) {
		return cat(s("DELETE "), r(node.pattern()));
	}

	@Override
	public Stream<String> visitInsertClause(InsertClause node) {
		return cat(s("INSERT "), r(node.pattern()));
	}

	@Override
	public Stream<String> visitUsingClause(UsingClause node) {
		return cat(s("USING "), keyword(node.named(), "NAMED "), r(node.iri()));
	}

	@Override
	public Stream<String> visitGraphOrDefault(GraphOrDefault node) {
		if (node.isDefault()) {
			return s("DEFAULT");
		}
		return cat(keyword(node.graphKeyword(), "GRAPH "), r(node.iri()));
	}

	@Override
	public Stream<String> visitGraphRef(GraphRef node) {
		return cat(s("GRAPH "), r(node.iri()));
	}

	@Override
	public Stream<String> visitGraphRefAllKeyword(GraphRefAllKeyword node) {
		return s(node.name());
	}

	@Override
	public Stream<String> visitQuadPattern(QuadPattern node) {
		return braced(node.quads());
	}

	@Override
	public Stream<String> visitQuadData(QuadData node) {
		return braced(node.quads());
	}

	@Override
	public Stream<String> visitQuads(Quads node) {
		return interleaved(node.templates(), node.graphs());
	}

	@Override
	public Stream<String> visitQuadsNotTriples(QuadsNotTriples node) {
		return cat(s("GRAPH "), r(node.graph()), s(" "), braced(node.template()));
	}

	@Override
	public Stream<String> visitTriplesTemplate(TriplesTemplate node) {
		return join(node.items(), " . ");
	}

	/**
	 * {@code { content }}, or {@code { }} when the content is absent.
	 */
	private Stream<String> braced(SparqlNode content) {
		return content == null ? s("{ }") : cat(s("{ "), r(content), s(" }"));
	}

	// Graph patterns

	@Override
	public Stream<String> visitGroupGraphPattern(GroupGraphPattern node) {
		return braced(node.content());
	}

	@Override
	public Stream<String> visitGroupGraphPatternSub(GroupGraphPatternSub node) {
		return interleaved(node.triplesBlocks(), node.patterns());
	}

	@Override
	public Stream<String> visitTriplesBlock(TriplesBlock node) {
		return join(node.items(), " . ");
	}

	@Override
	public Stream<String> visitOptionalGraphPattern(OptionalGraphPattern node) {
		return cat(s("OPTIONAL "), r(node.pattern()));
	}

	@Override
	public Stream<String> visitMinusGraphPattern(MinusGraphPattern node) {
		return cat(s("MINUS "), r(node.pattern()));
	}

	@Override
	public Stream<String> visitGraphGraphPattern(GraphGraphPattern node) {
		return cat(s("GRAPH "), r(node.graph()), s(" "), r(node.pattern()));
	}

	@Override
	public Stream<String> visitServiceGraphPattern(ServiceGraphPattern node) {
		return cat(s("SERVICE "), keyword(node.silent(), "SILENT "), r(node.endpoint()), s(" "), r(node.pattern()));
	}

	@Override
	public Stream<String> visitGroupOrUnionGraphPattern(GroupOrUnionGraphPattern node) {
		return join(node.items(), " UNION ");
	}

	@Override
	public Stream<String> visitFilter(Filter node) {
		return cat(s("FILTER "), r(node.constraint()));
	}

	@Override
	public Stream<String> visitBind(Bind node) {
		return cat(s("BIND("), r(node.expression()), s(" AS "), r(node.var()), s(")"));
	}

	@Override
	public Stream<String> visitInlineData(InlineData node) {
		return cat(s("VALUES "), r(node.block()));
	}

	@Override
	public Stream<String> visitInlineDataOneVar(InlineDataOneVar node) {
		return cat(r(node.var()), s(" {"), each(" ", node.values()), s(" }"));
	}

	@Override
	public Stream<String> visitInlineDataFull(InlineDataFull node) {
		return cat(s("("), join(node.vars(), " "), s(") {"), each(" ", node.rows()), s(" }"));
	}

	@Override
	public Stream<String> visitDataBlockRow(DataBlockRow node) {
		return cat(s("("), join(node.values(), " "), s(")"));
	}

	@Override
	public Stream<String> visitUndef(Undef node) {
		return s("UNDEF");
	}

	// Triples

	@Override
	public Stream<String> visitConstructTemplate(ConstructTemplate node) {
		return braced(node.triples());
	}

	@Override
	public Stream<String> visitConstructTriples(ConstructTriples node) {
		return join(node.items(), " . ");
	}

	@Override
	public Stream<String> visitTriplesSameSubject(TriplesSameSubject node) {
		return cat(r(node.subject()), opt(" ", node.properties()));
	}

	@Override
	public Stream<String> visitPropertyListNotEmpty(PropertyListNotEmpty node) {
		List<PropertyListNotEmpty.Pair> pairs = node.items();
		return IntStream.range(0, pairs.size()).boxed()
			.flatMap(i -> cat(keyword(i > 0, ";"), r(pairs.get(i).verb()), s(" "), r(pairs.get(i).objects())));
	}

	@Override
	public Stream<String> visitObjectList(ObjectList node) {
		return join(node.items(), ",");
	}

	@Override
	public Stream<String> visitTriplesSameSubjectPath(TriplesSameSubjectPath node) {
		return cat(r(node.subject()), opt(" ", node.properties()));
	}

	@Override
	public Stream<String> visitPropertyListPathNotEmpty(PropertyListPathNotEmpty node) {
		return cat(r(node.first().verb()), s(" "), r(node.first().objects()),
			node.rest().stream().flatMap(pair -> cat(s(";"), r(pair.verb()), s(" "), r(pair.objects()))));
	}

	@Override
	public Stream<String> visitObjectListPath(ObjectListPath node) {
		return join(node.items(), ",");
	}

	@Override
	public Stream<String> visitRdfTypeKeyword(RdfTypeKeyword node) {
		return s(node.keyword());
	}

	@Override
	public Stream<String> visitCollection(Collection node) {
		return cat(s("("), join(node.items(), " "), s(")"));
	}

	@Override
	public Stream<String> visitCollectionPath(CollectionPath node) {
		return cat(s("("), join(node.items(), " "), s(")"));
	}

	@Override
	public Stream<String> visitBlankNodePropertyList(BlankNodePropertyList node) {
		return cat(s("[ "), r(node.properties()), s(" ]"));
	}

	@Override
	public Stream<String> visitBlankNodePropertyListPath(BlankNodePropertyListPath node) {
		return cat(s("[ "), r(node.properties()), s(" ]"));
	}

	// Property paths

	@Override
	public Stream<String> visitPathAlternative(PathAlternative node) {
		return join(node.items(), "|");
	}

	@Override
	public Stream<String> visitPathSequence(PathSequence node) {
		return join(node.items(), "/");
	}

	@Override
	public Stream<String> visitPathEltOrInverse(PathEltOrInverse node) {
		return cat(keyword(node.inverse(), "^"), r(node.element()));
	}

	@Override
	public Stream<String> visitPathElt(PathElt node) {
		return cat(r(node.primary()), node.modifier() == null ? Stream.empty() : s(node.modifier().symbol()));
	}

	@Override
	public Stream<String> visitGroupedPath(GroupedPath node) {
		return cat(s("("), r(node.path()), s(")"));
	}

	@Override
	public Stream<String> visitPathNegatedPropertySet(PathNegatedPropertySet node) {
		if (node.rest().isEmpty()) {
			return cat(s("!"), r(node.first()));
		}
		return cat(s("!("), join(node.items(), "|"), s(")"));
	}

	@Override
	public Stream<String> visitPathOneInPropertySet(PathOneInPropertySet node) {
		return cat(keyword(node.inverse(), "^"), r(node.target()));
	}

	// Terms

	@Override
	public Stream<String> visitVar(Var node) {
		return r(node.token());
	}

	@Override
	public Stream<String> visitIri(Iri node) {
		return r(node.token());
	}

	@Override
	public Stream<String> visitRdfLiteral(RdfLiteral node) {
		return cat(r(node.value()), opt("", node.language()), opt("^^", node.datatype()));
	}

	@Override
	public Stream<String> visitNumericLiteral(NumericLiteral node) {
		return r(node.token());
	}

	@Override
	public Stream<String> visitBooleanLiteral(BooleanLiteral node) {
		return s(node.keyword());
	}

	@Override
	public Stream<String> visitBlankNode(BlankNode node) {
		return r(node.token());
	}

	@Override
	public Stream<String> visitNilTerm(NilTerm node) {
		return r(node.nil());
	}

	// Expressions

	@Override
	public Stream<String> visitExpression(Expression node) {
		return r(node.or());
	}

	@Override
	public Stream<String> visitConditionalOrExpression(ConditionalOrExpression node) {
		return join(node.items(), " || ");
	}

	@Override
	public Stream<String> visitConditionalAndExpression(ConditionalAndExpression node) {
		return join(node.items(), " && ");
	}

	@Override
	public Stream<String> visitValueLogical(ValueLogical node) {
		return r(node.relational());
	}

	@Override
	public Stream<String> visitRelationalExpression(RelationalExpression node) {
		RelationalExpression.Tail tail = node.tail();
		if (tail instanceof RelationalExpression.Comparison comparison) {
			return cat(r(node.left()), s(" " + comparison.operator().symbol() + " "), r(comparison.right()));
		}
		if (tail instanceof RelationalExpression.Membership membership) {
			return cat(r(node.left()), s(" " + membership.operator().keyword() + " "), r(membership.list()));
		}
		return r(node.left());
	}

	@Override
	public Stream<String> visitNumericExpression(NumericExpression node) {
		return r(node.additive());
	}

	@Override
	public Stream<String> visitAdditiveExpression(AdditiveExpression node) {
		return cat(r(node.first()), node.steps().stream().flatMap(this::additiveStep));
	}

	private Stream<String> additiveStep(AdditiveExpression.Step step) {
		if (step instanceof AdditiveExpression.AdditiveStep additive) {
			return cat(s(" " + additive.operator().symbol() + " "), r(additive.operand()));
		}
		AdditiveExpression.SignedLiteralStep signed = (AdditiveExpression.SignedLiteralStep) step;
		return cat(s(" "), r(signed.literal()), signed.factors().stream().flatMap(this::factor));
	}

	@Override
	public Stream<String> visitMultiplicativeExpression(MultiplicativeExpression node) {
		return cat(r(node.first()), node.factors().stream().flatMap(this::factor));
	}

	private Stream<String> factor(MultiplicativeExpression.Factor factor) {
		return cat(s(" " + factor.operator().symbol() + " "), r(factor.operand()));
	}

	@Override
	public Stream<String> visitUnaryExpression(UnaryExpression node) {
		return cat(node.operator() == null ? Stream.empty() : s(node.operator().symbol()), r(node.operand()));
	}

	@Override
	public Stream<String> visitBrackettedExpression(BrackettedExpression node) {
		return cat(s("("), r(node.expression()), s(")"));
	}

	@Override
	public Stream<String> visitIriOrFunction(IriOrFunction node) {
		return cat(r(node.iri()), opt("", node.args()));
	}

	@Override
	public Stream<String> visitFunctionCall(FunctionCall node) {
		return cat(r(node.iri()), r(node.args()));
	}

	@Override
	public Stream<String> visitArgList(ArgList node) {
		return cat(s("("), keyword(node.distinct(), "DISTINCT "), join(node.args(), ", "), s(")"));
	}

	@Override
	public Stream<String> visitExpressionList(ExpressionList node) {
		return cat(s("("), join(node.expressions(), ", "), s(")"));
	}

	// Built-in calls

	@Override
	public Stream<String> visitBuiltInFunctionCall(BuiltInFunctionCall node) {
		return cat(s(node.function().keyword() + "("), join(node.args(), ", "), s(")"));
	}

	@Override
	public Stream<String> visitBoundCall(BoundCall node) {
		return cat(s("BOUND("), r(node.var()), s(")"));
	}

	@Override
	public Stream<String> visitRegexExpression(RegexExpression node) {
		return cat(s("REGEX("), r(node.text()), s(", "), r(node.pattern()), opt(", ", node.flags()), s(")"));
	}

	@Override
	public Stream<String> visitSubstringExpression(SubstringExpression node) {
		return cat(s("SUBSTR("), r(node.source()), s(", "), r(node.start()), opt(", ", node.length()), s(")"));
	}

	@Override
	public Stream<String> visitStrReplaceExpression(StrReplaceExpression node) {
		return cat(s("REPLACE("), r(node.arg()), s(", "), r(node.pattern()), s(", "), r(node.replacement()),
			opt(", ", node.flags()), s(")"));
	}

	@Override
	public Stream<String> visitExistsFunc(ExistsFunc node) {
		return cat(s("EXISTS "), r(node.pattern()));
	}

	@Override
	public Stream<String> visitNotExistsFunc(NotExistsFunc node) {
		return cat(s("NOT EXISTS "), r(node.pattern()));
	}

	@Override
	public Stream<String> visitCountAggregate(CountAggregate node) {
		return cat(s("COUNT("), keyword(node.distinct(), "DISTINCT "),
			node.countsAll() ? s("*") : r(node.expression()), s(")"));
	}

	@Override
	public Stream<String> visitSimpleAggregate(SimpleAggregate node) {
		return cat(s(node.function().name() + "("), keyword(node.distinct(), "DISTINCT "), r(node.expression()),
			s(")"));
	}

	@Override
	public Stream<String> visitGroupConcatAggregate(GroupConcatAggregate node) {
		return cat(s("GROUP_CONCAT("), keyword(node.distinct(), "DISTINCT "), r(node.expression()),
			opt("; SEPARATOR=", node.separator()), s(")"));
	}
}
