package org.javai.sparql.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.sparql.testsupport.SparqlSyntaxAssertions.assertCorrectUpdateSyntax;

import java.util.ArrayList;
import java.util.List;
import org.apache.jena.update.UpdateRequest;
import org.javai.sparql.grammar.Add;
import org.javai.sparql.grammar.BooleanLiteral;
import org.javai.sparql.grammar.Clear;
import org.javai.sparql.grammar.Copy;
import org.javai.sparql.grammar.Create;
import org.javai.sparql.grammar.DeleteClause;
import org.javai.sparql.grammar.DeleteData;
import org.javai.sparql.grammar.DeleteWhere;
import org.javai.sparql.grammar.Drop;
import org.javai.sparql.grammar.GraphNode;
import org.javai.sparql.grammar.GraphOrDefault;
import org.javai.sparql.grammar.GraphRef;
import org.javai.sparql.grammar.GraphRefAllKeyword;
import org.javai.sparql.grammar.GroupGraphPattern;
import org.javai.sparql.grammar.InsertClause;
import org.javai.sparql.grammar.InsertData;
import org.javai.sparql.grammar.Iri;
import org.javai.sparql.grammar.Load;
import org.javai.sparql.grammar.Modify;
import org.javai.sparql.grammar.Move;
import org.javai.sparql.grammar.NumericLiteral;
import org.javai.sparql.grammar.ObjectList;
import org.javai.sparql.grammar.ObjectListPath;
import org.javai.sparql.grammar.PathAlternative;
import org.javai.sparql.grammar.PrefixDecl;
import org.javai.sparql.grammar.Prologue;
import org.javai.sparql.grammar.PropertyListNotEmpty;
import org.javai.sparql.grammar.PropertyListPathNotEmpty;
import org.javai.sparql.grammar.QuadData;
import org.javai.sparql.grammar.QuadPattern;
import org.javai.sparql.grammar.Quads;
import org.javai.sparql.grammar.QuadsNotTriples;
import org.javai.sparql.grammar.RdfLiteral;
import org.javai.sparql.grammar.TriplesBlock;
import org.javai.sparql.grammar.TriplesSameSubject;
import org.javai.sparql.grammar.TriplesSameSubjectPath;
import org.javai.sparql.grammar.TriplesTemplate;
import org.javai.sparql.grammar.Update;
import org.javai.sparql.grammar.Update1;
import org.javai.sparql.grammar.UpdateUnit;
import org.javai.sparql.grammar.UsingClause;
import org.javai.sparql.grammar.Var;
import org.javai.sparql.grammar.VarOrTerm;
import org.javai.sparql.grammar.Verb;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SparqlRenderer} on SPARQL Update trees.
 */
class SparqlUpdateRendererTest {

	private static final String EX = "http://example.org/";

	private static final Var S = Var.of("s");
	private static final Var O = Var.of("o");
	private static final Iri GRAPH = Iri.of(EX + "g");

	private static TriplesSameSubject triple(VarOrTerm subject, Verb predicate, GraphNode object) {
		return new TriplesSameSubject(subject, PropertyListNotEmpty.of(predicate, ObjectList.of(object)));
	}

	private static TriplesTemplate template(VarOrTerm subject, String predicate, GraphNode object) {
		return TriplesTemplate.of(triple(subject, Iri.of(EX + predicate), object));
	}

	@Test
	void insertData() {
		InsertData insert = new InsertData(new QuadData(Quads.of(
			template(Iri.of(EX + "alice"), "name", RdfLiteral.of("Alice")))));

		String sparql = insert.render();

		assertThat(sparql).isEqualTo("INSERT DATA { <http://example.org/alice> <http://example.org/name> \"Alice\" }");
		assertCorrectUpdateSyntax(sparql);
	}

	@Test
	void quadsInterleaveTemplatesAndGraphBlocks() {
		Quads quads = new Quads(
			List.of(template(Iri.of(EX + "a"), "p", NumericLiteral.of(1)), template(Iri.of(EX + "b"), "p", NumericLiteral.of(2))),
			List.of(new QuadsNotTriples(GRAPH, template(Iri.of(EX + "c"), "p", NumericLiteral.of(3)))));
		DeleteData delete = new DeleteData(new QuadData(quads));

		String sparql = delete.render();

		assertThat(sparql).isEqualTo("DELETE DATA { <http://example.org/a> <http://example.org/p> 1"
			+ " GRAPH <http://example.org/g> { <http://example.org/c> <http://example.org/p> 3 }"
			+ " . <http://example.org/b> <http://example.org/p> 2 }");
		assertCorrectUpdateSyntax(sparql);
	}

	@Test
	void emptyGraphBlock() {
		QuadsNotTriples empty = new QuadsNotTriples(GRAPH, null);

		assertThat(empty.render()).isEqualTo("GRAPH <http://example.org/g> { }");
	}

	@Test
	void deleteWhere() {
		DeleteWhere delete = new DeleteWhere(new QuadPattern(Quads.of(template(S, "p", O))));

		String sparql = delete.render();

		assertThat(sparql).isEqualTo("DELETE WHERE { ?s <http://example.org/p> ?o }");
		assertCorrectUpdateSyntax(sparql);
	}

	@Test
	void modifyWithGraphDeleteAndInsert() {
		Modify modify = new Modify(GRAPH,
			new DeleteClause(new QuadPattern(Quads.of(template(S, "old", O)))),
			new InsertClause(new QuadPattern(Quads.of(template(S, "new", O)))),
			List.of(),
			GroupGraphPattern.of(TriplesBlock.of(new TriplesSameSubjectPath(S,
				PropertyListPathNotEmpty.of(PathAlternative.of(Iri.of(EX + "old")), ObjectListPath.of(O))))));

		String sparql = modify.render();

		assertThat(sparql).isEqualTo("WITH <http://example.org/g>\n"
			+ "DELETE { ?s <http://example.org/old> ?o }\n"
			+ "INSERT { ?s <http://example.org/new> ?o }\n"
			+ "WHERE { ?s <http://example.org/old> ?o }");
		assertCorrectUpdateSyntax(sparql);
	}

	@Test
	void insertOnlyModifyWithUsingClauses() {
		Modify modify = new Modify(null, null,
			new InsertClause(new QuadPattern(Quads.of(template(S, "seen", BooleanLiteral.TRUE)))),
			List.of(new UsingClause(Iri.of(EX + "u"), false), new UsingClause(Iri.of(EX + "n"), true)),
			GroupGraphPattern.of(TriplesBlock.of(new TriplesSameSubjectPath(S,
				PropertyListPathNotEmpty.of(Var.of("p"), ObjectListPath.of(O))))));

		String sparql = modify.render();

		assertThat(sparql).isEqualTo("INSERT { ?s <http://example.org/seen> true }\n"
			+ "USING <http://example.org/u>\n"
			+ "USING NAMED <http://example.org/n>\n"
			+ "WHERE { ?s ?p ?o }");
		assertCorrectUpdateSyntax(sparql);
	}

	@Test
	void graphManagementOperations() {
		assertThat(new Load(true, Iri.of(EX + "data.ttl"), new GraphRef(GRAPH)).render())
			.isEqualTo("LOAD SILENT <http://example.org/data.ttl> INTO GRAPH <http://example.org/g>");
		assertThat(new Load(false, Iri.of(EX + "data.ttl"), null).render())
			.isEqualTo("LOAD <http://example.org/data.ttl>");
		assertThat(new Clear(false, GraphRefAllKeyword.ALL).render()).isEqualTo("CLEAR ALL");
		assertThat(new Clear(true, GraphRefAllKeyword.DEFAULT).render()).isEqualTo("CLEAR SILENT DEFAULT");
		assertThat(new Drop(true, new GraphRef(GRAPH)).render()).isEqualTo("DROP SILENT GRAPH <http://example.org/g>");
		assertThat(new Create(false, new GraphRef(GRAPH)).render()).isEqualTo("CREATE GRAPH <http://example.org/g>");
	}

	@Test
	void graphTransferOperations() {
		assertThat(new Add(false, GraphOrDefault.defaultGraph(), GraphOrDefault.graph(GRAPH)).render())
			.isEqualTo("ADD DEFAULT TO GRAPH <http://example.org/g>");
		assertThat(new Move(true, GraphOrDefault.graph(GRAPH), GraphOrDefault.defaultGraph()).render())
			.isEqualTo("MOVE SILENT GRAPH <http://example.org/g> TO DEFAULT");
		assertThat(new Copy(false, new GraphOrDefault(GRAPH, false), GraphOrDefault.defaultGraph()).render())
			.isEqualTo("COPY <http://example.org/g> TO DEFAULT");
	}

	@Test
	void operationsChainWithSemicolons() {
		Update update = Update.of(
			Prologue.of(PrefixDecl.of("ex", EX)),
			List.of(
				new Create(false, new GraphRef(Iri.prefixed("ex:g"))),
				new Load(false, Iri.prefixed("ex:data"), new GraphRef(Iri.prefixed("ex:g"))),
				new Clear(true, GraphRefAllKeyword.NAMED)));

		String sparql = new UpdateUnit(update).render();

		assertThat(sparql).isEqualTo("PREFIX ex: <http://example.org/>\n"
			+ "CREATE GRAPH ex:g ;\n"
			+ "LOAD ex:data INTO GRAPH ex:g ;\n"
			+ "CLEAR SILENT NAMED");
		UpdateRequest request = assertCorrectUpdateSyntax(sparql);
		assertThat(request.getOperations()).hasSize(3);
	}

	@Test
	void longOperationChainRendersWithoutDeepRecursion() {
		int count = 3000;
		List<Update1> operations = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			operations.add(new Clear(false, new GraphRef(Iri.of(EX + "g" + i))));
		}

		String sparql = Update.of(operations).render();

		assertThat(sparql).startsWith("CLEAR GRAPH <http://example.org/g0> ;\n")
			.endsWith("CLEAR GRAPH <http://example.org/g2999>");
		assertThat(sparql.split(" ;\n")).hasSize(count);
		UpdateRequest request = assertCorrectUpdateSyntax(sparql);
		assertThat(request.getOperations()).hasSize(count);
	}

	@Test
	void trailingPrologueWithoutOperation() {
		Update last = new Update(Prologue.of(PrefixDecl.of("ex", EX)), null, null);
		Update update = new Update(Prologue.empty(), new Clear(false, GraphRefAllKeyword.ALL), last);

		assertThat(update.render()).isEqualTo("CLEAR ALL ;\nPREFIX ex: <http://example.org/>\n");
	}
}
