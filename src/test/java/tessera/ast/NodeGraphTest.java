package tessera.ast;

import org.junit.jupiter.api.Test;
import tessera.ast.expr.BinaryOp;
import tessera.ast.expr.Literal;
import tessera.ast.expr.Operator;
import tessera.ast.expr.Range;
import tessera.ast.expr.Variable;
import tessera.ast.stmt.Assign;
import tessera.ast.stmt.CodeBlock;
import tessera.ast.stmt.For;
import tessera.ast.stmt.Print;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tessera.TestTrees.INT;
import static tessera.TestTrees.intVar;

public class NodeGraphTest {
	@Test
	void addRegistersDescendantsAndIndexesUsers() {
		NodeGraph graph = new NodeGraph(Stage.SEMANTIC);
		Variable x = intVar("x");
		Literal one = Literal.integer(1);
		BinaryOp sum = graph.add(new BinaryOp(Operator.ADD, x, one, INT));

		assertTrue(graph.contains(x));
		assertTrue(graph.contains(one));
		assertEquals(3, graph.size());
		Set<Node> users = graph.users(x);
		assertEquals(1, users.size());
		assertTrue(users.contains(sum));
		assertTrue(graph.users(sum).isEmpty());
	}

	@Test
	void addingTwiceIsANoOp() {
		NodeGraph graph = new NodeGraph(Stage.SEMANTIC);
		Variable x = graph.add(intVar("x"));
		int id = x.id();

		graph.add(x);

		assertEquals(1, graph.size());
		assertEquals(id, x.id());
	}

	@Test
	void nodeOfAnotherGraphIsRejected() {
		NodeGraph first = new NodeGraph(Stage.SEMANTIC);
		Variable x = first.add(intVar("x"));

		assertThrows(StructuralViolationException.class, () -> new NodeGraph(Stage.SEMANTIC).add(x));
	}

	@Test
	void substituteUpdatesBothDirectionsOfTheIndex() {
		NodeGraph graph = new NodeGraph(Stage.SEMANTIC);
		Variable x = intVar("x");
		Variable y = intVar("y");
		BinaryOp sum = graph.add(new BinaryOp(Operator.ADD, x, Literal.integer(1), INT));

		graph.substitute(sum, x, y);

		assertSame(y, sum.args().get(0));
		assertTrue(graph.users(x).isEmpty());
		assertTrue(graph.users(y).contains(sum));
	}

	@Test
	void substituteRebindsEveryEntryOfADuplicatedChild() {
		NodeGraph graph = new NodeGraph(Stage.SEMANTIC);
		Variable x = intVar("x");
		Variable y = intVar("y");
		BinaryOp square = graph.add(new BinaryOp(Operator.MUL, x, x, INT));
		assertEquals(1, graph.users(x).size());

		graph.substitute(square, x, y);

		assertEquals(List.of(y, y), square.args());
		assertTrue(graph.users(x).isEmpty());
		assertEquals(1, graph.users(y).size());
	}

	@Test
	void strictSubstituteWithoutMatchingSlotThrows() {
		NodeGraph graph = new NodeGraph(Stage.SEMANTIC);
		BinaryOp sum = graph.add(new BinaryOp(Operator.ADD, intVar("x"), Literal.integer(1), INT));
		Variable stranger = graph.add(intVar("z"));

		assertThrows(StructuralViolationException.class, () -> graph.substitute(sum, stranger, intVar("y")));
	}

	@Test
	void substituteAllCountsOwnersAndAcceptsZero() {
		NodeGraph graph = new NodeGraph(Stage.SEMANTIC);
		Variable a = intVar("a");
		Variable x = intVar("x");
		Variable y = intVar("y");
		CodeBlock block = graph.add(CodeBlock.of(new Assign(a, x), new Print(List.of(x))));

		assertEquals(2, graph.substituteAll(block, x, y));
		assertTrue(graph.users(x).isEmpty());
		assertEquals(2, graph.users(y).size());
		assertEquals(0, graph.substituteAll(block, x, y));
	}

	@Test
	void userNodesSearchesUpwardsForTheRequestedType() {
		NodeGraph graph = new NodeGraph(Stage.SEMANTIC);
		Variable i = intVar("i");
		Literal one = Literal.integer(1);
		For loop = new For(i, new Range(Literal.integer(0), intVar("n")),
				CodeBlock.of(new Assign(intVar("s"), new BinaryOp(Operator.ADD, i, one, INT))));
		graph.add(CodeBlock.of(loop));

		List<For> loops = graph.userNodes(one, For.class);

		assertEquals(1, loops.size());
		assertSame(loop, loops.get(0));
		assertTrue(graph.userNodes(loop, For.class).isEmpty());
	}

	@Test
	void unknownNodeHasNoUsers() {
		NodeGraph graph = new NodeGraph(Stage.SEMANTIC);

		assertFalse(graph.contains(intVar("x")));
		assertThrows(StructuralViolationException.class, () -> graph.users(intVar("x")));
	}
}
