package org.javai.sparql;

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
 * Visitor interface for SPARQL syntax trees.
 *
 * There is one method per concrete node type, so every operation implemented
 * as a visitor handles every grammar production.
 *
 * @param <R> the return type of the visitor operations
 */
public interface SparqlNodeVisitor<R> {

	/**
	 * Visits a leaf token.
	 *
	 * @param terminal the terminal
	 * @return the result of visiting this node
	 */
	R visitTerminal(Terminal terminal);

	// Query

	R visitQueryUnit(QueryUnit node);

	R visitQuery(Query node);

	R visitPrologue(Prologue node);

	R visitBaseDecl(BaseDecl node);

	R visitPrefixDecl(PrefixDecl node);

	R visitSelectQuery(SelectQuery node);

	R visitSubSelect(SubSelect node);

	R visitSelectClause(SelectClause node);

	R visitSelectBinding(SelectBinding node);

	R visitConstructQuery(ConstructQuery node);

	R visitConstructWhereQuery(ConstructWhereQuery node);

	R visitDescribeQuery(DescribeQuery node);

	R visitAskQuery(AskQuery node);

	R visitDefaultGraphClause(DefaultGraphClause node);

	R visitNamedGraphClause(NamedGraphClause node);

	R visitWhereClause(WhereClause node);

	R visitSolutionModifier(SolutionModifier node);

	R visitGroupClause(GroupClause node);

	R visitGroupBinding(GroupBinding node);

	R visitHavingClause(HavingClause node);

	R visitOrderClause(OrderClause node);

	R visitDirectedOrder(DirectedOrder node);

	R visitLimitOffsetClauses(LimitOffsetClauses node);

	R visitLimitClause(LimitClause node);

	R visitOffsetClause(OffsetClause node);

	R visitValuesClause(ValuesClause node);

	// Update

	R visitUpdateUnit(UpdateUnit node);

	R visitUpdate(Update node);

	R visitLoad(Load node);

	R visitClear(Clear node);

	R visitDrop(Drop node);

	R visitCreate(Create node);

	R visitAdd(Add node);

	R visitMove(Move node);

	R visitCopy(Copy node);

	R visitInsertData(InsertData node);

	R visitDeleteData(DeleteData node);

	R visitDeleteWhere(DeleteWhere node);

	R visitModify(Modify node);

	R visitDeleteClause(DeleteClause node);

	R visitInsertClause(InsertClause node);

	R visitUsingClause(UsingClause node);

	R visitGraphOrDefault(GraphOrDefault node);

	R visitGraphRef(GraphRef node);

	R visitGraphRefAllKeyword(GraphRefAllKeyword node);

	R visitQuadPattern(QuadPattern node);

	R visitQuadData(QuadData node);

	R visitQuads(Quads node);

	R visitQuadsNotTriples(QuadsNotTriples node);

	R visitTriplesTemplate(TriplesTemplate node);

	// Graph patterns

	R visitGroupGraphPattern(GroupGraphPattern node);

	R visitGroupGraphPatternSub(GroupGraphPatternSub node);

	R visitTriplesBlock(TriplesBlock node);

	R visitOptionalGraphPattern(OptionalGraphPattern node);

	R visitMinusGraphPattern(MinusGraphPattern node);

	R visitGraphGraphPattern(GraphGraphPattern node);

	R visitServiceGraphPattern(ServiceGraphPattern node);

	R visitGroupOrUnionGraphPattern(GroupOrUnionGraphPattern node);

	R visitFilter(Filter node);

	R visitBind(Bind node);

	R visitInlineData(InlineData node);

	R visitInlineDataOneVar(InlineDataOneVar node);

	R visitInlineDataFull(InlineDataFull node);

	R visitDataBlockRow(DataBlockRow node);

	R visitUndef(Undef node);

	// Triples

	R visitConstructTemplate(ConstructTemplate node);

	R visitConstructTriples(ConstructTriples node);

	R visitTriplesSameSubject(TriplesSameSubject node);

	R visitPropertyListNotEmpty(PropertyListNotEmpty node);

	R visitObjectList(ObjectList node);

	R visitTriplesSameSubjectPath(TriplesSameSubjectPath node);

	R visitPropertyListPathNotEmpty(PropertyListPathNotEmpty node);

	R visitObjectListPath(ObjectListPath node);

	R visitRdfTypeKeyword(RdfTypeKeyword node);

	R visitCollection(Collection node);

	R visitCollectionPath(CollectionPath node);

	R visitBlankNodePropertyList(BlankNodePropertyList node);

	R visitBlankNodePropertyListPath(BlankNodePropertyListPath node);

	// Property paths

	R visitPathAlternative(PathAlternative node);

	R visitPathSequence(PathSequence node);

	R visitPathEltOrInverse(PathEltOrInverse node);

	R visitPathElt(PathElt node);

	R visitGroupedPath(GroupedPath node);

	R visitPathNegatedPropertySet(PathNegatedPropertySet node);

	R visitPathOneInPropertySet(PathOneInPropertySet node);

	// Terms

	R visitVar(Var node);

	R visitIri(Iri node);

	R visitRdfLiteral(RdfLiteral node);

	R visitNumericLiteral(NumericLiteral node);

	R visitBooleanLiteral(BooleanLiteral node);

	R visitBlankNode(BlankNode node);

	R visitNilTerm(NilTerm node);

	// Expressions

	R visitExpression(Expression node);

	R visitConditionalOrExpression(ConditionalOrExpression node);

	R visitConditionalAndExpression(ConditionalAndExpression node);

	R visitValueLogical(ValueLogical node);

	R visitRelationalExpression(RelationalExpression node);

	R visitNumericExpression(NumericExpression node);

	R visitAdditiveExpression(AdditiveExpression node);

	R visitMultiplicativeExpression(MultiplicativeExpression node);

	R visitUnaryExpression(UnaryExpression node);

	R visitBrackettedExpression(BrackettedExpression node);

	R visitIriOrFunction(IriOrFunction node);

	R visitFunctionCall(FunctionCall node);

	R visitArgList(ArgList node);

	R visitExpressionList(ExpressionList node);

	// Built-in calls

	R visitBuiltInFunctionCall(BuiltInFunctionCall node);

	R visitBoundCall(BoundCall node);

	R visitRegexExpression(RegexExpression node);

	R visitSubstringExpression(SubstringExpression node);

	R visitStrReplaceExpression(StrReplaceExpression node);

	R visitExistsFunc(ExistsFunc node);

	R visitNotExistsFunc(NotExistsFunc node);

	R visitCountAggregate(CountAggregate node);

	R visitSimpleAggregate(SimpleAggregate node);

	R visitGroupConcatAggregate(GroupConcatAggregate node);
}
