package tessera.transform;

import org.junit.jupiter.api.Test;
import tessera.ast.Node;
import tessera.ast.NodeGraph;
import tessera.ast.SourceSpan;
import tessera.ast.Stage;
import tessera.ast.expr.BinaryOp;
import tessera.ast.expr.CombinationMode;
import tessera.ast.expr.Comprehension;
import tessera.ast.expr.LibraryCall;
import tessera.ast.expr.LibraryFunction;
import tessera.ast.expr.Literal;
import tessera.ast.expr.Operator;
import tessera.ast.expr.Range;
import tessera.ast.expr.Variable;
import tessera.ast.stmt.Assign;
import tessera.ast.stmt.AugAssign;
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

public class ComprehensionLoweringTest {
	private final NodeGraph graph = new NodeGraph(Stage.SEMANTIC);
	private final ComprehensionLowering lowering = new ComprehensionLowering();

	private final Variable i = intVar("i");
	private final Variable j = intVar("j");
	private final Variable acc = intVar("acc");
	private final Range rows = new Range(Literal.integer(0), intVar("n"));
	private final Range cols = new Range(Literal.integer(0), intVar("m"));
	private final BinaryOp product = new BinaryOp(Operator.MUL, i, j, INT);

	private Comprehension comprehension(CombinationMode mode, Node update) {
		Node nest = new For(i, rows, CodeBlock.of(new For(j, cols, CodeBlock.of(update))));
		return graph.add(new Comprehension(mode, List.of(new Assign(acc, Literal.integer(0))), nest, intVar("r"),
				List.of(i, j), acc, INT, SourceSpan.ofLine(4)));
	}

	@Test
	void recoversElementAndIterablesOfASum() {
		Comprehension sum = comprehension(CombinationMode.SUM,
				new Assign(acc, new BinaryOp(Operator.ADD, acc, product, INT)));

		LoweredComprehension lowered = lowering.lower(sum);

		assertSame(product, lowered.element());
		assertEquals(2, lowered.iterables().size());
		assertSame(rows, lowered.iterables().get(0));
		assertSame(cols, lowered.iterables().get(1));

		List<LoweredComprehension.ForClause> clauses = lowered.clauses(sum.indices(), sum.span());
		assertSame(i, clauses.get(0).index());
		assertSame(cols, clauses.get(1).iterable());
	}

	@Test
	void augmentedUpdateContributesItsRightHandSide() {
		Comprehension sum = comprehension(CombinationMode.SUM, new AugAssign(acc, Operator.ADD, product));

		assertSame(product, lowering.lower(sum).element());
	}

	@Test
	void runningResultIsStrippedFromMaxReduction() {
		LibraryCall max = new LibraryCall(LibraryFunction.builtin("max", false), List.of(acc, product), INT);
		Comprehension reduction = comprehension(CombinationMode.MAX, new Assign(acc, max));

		assertSame(product, lowering.lower(reduction).element());
	}

	@Test
	void runningResultIsStrippedFromLongerSums() {
		Variable k = intVar("k");
		BinaryOp update = new BinaryOp(Operator.ADD, List.of(acc, product, k), INT, SourceSpan.NONE);
		Comprehension sum = comprehension(CombinationMode.SUM, new Assign(acc, update));

		Node element = lowering.lower(sum).element();

		BinaryOp rebuilt = (BinaryOp) element;
		assertEquals(List.of(product, k), rebuilt.args());
		assertFalse(graph.contains(rebuilt));
		assertEquals(Set.of(update), graph.users(product));
	}

	@Test
	void collectedElementIsTheAssignedValue() {
		Comprehension collect = comprehension(CombinationMode.COLLECT, new Assign(acc, product));

		assertSame(product, lowering.lower(collect).element());
	}

	@Test
	void unrelatedStatementInTheLoopBodyIsRejected() {
		Node nest = new For(i, rows, CodeBlock.of(
				new Assign(acc, new BinaryOp(Operator.ADD, acc, i, INT)),
				new Print(List.of(i))));
		Comprehension sum = graph.add(new Comprehension(CombinationMode.SUM, List.of(), nest, intVar("r"),
				List.of(i), acc, INT, SourceSpan.ofLine(9)));

		LoweringException e = assertThrows(LoweringException.class, () -> lowering.lower(sum));
		assertTrue(e.getMessage().startsWith("unexpected Print in the loop body"), e.getMessage());
		assertEquals(9, e.span().line());
	}

	@Test
	void indexCountMustMatchTheLoops() {
		Comprehension sum = comprehension(CombinationMode.SUM, new AugAssign(acc, Operator.ADD, product));
		LoweredComprehension lowered = lowering.lower(sum);

		assertThrows(LoweringException.class, () -> lowered.clauses(List.of(i), sum.span()));
	}

	@Test
	void nestedComprehensionReplacesItsResultVariable() {
		Variable innerAcc = intVar("t");
		Variable innerResult = intVar("t");
		Comprehension inner = new Comprehension(CombinationMode.SUM, List.of(new Assign(innerAcc, Literal.integer(0))),
				new For(j, new Range(Literal.integer(0), i), CodeBlock.of(
						new Assign(innerAcc, new BinaryOp(Operator.ADD, innerAcc, j, INT)))),
				innerResult, List.of(j), innerAcc, INT, SourceSpan.NONE);
		Comprehension outer = graph.add(new Comprehension(CombinationMode.SUM, List.of(),
				new For(i, rows, CodeBlock.of(inner,
						new Assign(acc, new BinaryOp(Operator.ADD, acc, innerResult, INT)))),
				intVar("r"), List.of(i), acc, INT, SourceSpan.NONE));

		BinaryOp update = (BinaryOp) ((Assign) ((For) outer.loopNest()).body().body().get(1)).rhs();

		LoweredComprehension lowered = lowering.lower(outer);

		assertSame(innerResult, lowered.element());
		assertSame(inner, lowered.resolve(lowered.element()));
		assertSame(acc, lowered.resolve(acc));
		assertEquals(List.of(rows), lowered.iterables());
		assertEquals(List.of(outer), graph.userNodes(inner, Comprehension.class));
		// the tree itself still reads the result variable
		assertEquals(List.of(acc, innerResult), update.args());
		assertTrue(graph.users(innerResult).contains(update));
	}
}
