package org.javai.sparql;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.javai.sparql.grammar.BoundCall;
import org.javai.sparql.grammar.Filter;
import org.javai.sparql.grammar.Var;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SparqlNodeWalker}.
 */
class SparqlNodeWalkerTest {

	private final Filter filter = new Filter(new BoundCall(Var.of("x")));

	@Test
	void preOrderVisitsParentsFirst() {
		List<String> visited = new ArrayList<>();

		SparqlNodeWalker.walkPreOrder(filter, node -> visited.add(node.production()));

		assertThat(visited).containsExactly("Filter", "BoundCall", "Var", "VarToken");
	}

	@Test
	void postOrderVisitsChildrenFirst() {
		List<String> visited = new ArrayList<>();

		SparqlNodeWalker.walkPostOrder(filter, node -> visited.add(node.production()));

		assertThat(visited).containsExactly("VarToken", "Var", "BoundCall", "Filter");
	}

	@Test
	void walkPrunesWhenPredicateIsFalse() {
		List<String> visited = new ArrayList<>();

		SparqlNodeWalker.walk(filter, node -> {
			visited.add(node.production());
			return !(node instanceof Var);
		});

		assertThat(visited).containsExactly("Filter", "BoundCall", "Var");
	}

	@Test
	void walkAllVisitsEachTreeInTurn() {
		List<String> visited = new ArrayList<>();

		SparqlNodeWalker.walkAll(List.of(Var.of("a"), Var.of("b")), node -> visited.add(node.render()));

		assertThat(visited).containsExactly("?a", "?a", "?b", "?b");
	}

	@Test
	void nullTreeIsIgnored() {
		List<SparqlNode> visited = new ArrayList<>();

		SparqlNodeWalker.walkPreOrder(null, visited::add);
		SparqlNodeWalker.walkPostOrder(null, visited::add);
		SparqlNodeWalker.walkAll(null, visited::add);

		assertThat(visited).isEmpty();
	}

	@Test
	void productionIsTheNodeTypeName() {
		assertThat(filter.production()).isEqualTo("Filter");
		assertThat(filter.children()).containsExactly(new BoundCall(Var.of("x")));
	}
}
