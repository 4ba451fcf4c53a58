package tessera.directive;

import org.junit.jupiter.api.Test;
import tessera.ast.NodeGraph;
import tessera.ast.StructuralViolationException;
import tessera.ast.Stage;
import tessera.ast.expr.BinaryOp;
import tessera.ast.expr.Literal;
import tessera.ast.expr.Operator;
import tessera.ast.expr.Range;
import tessera.ast.expr.Variable;
import tessera.ast.stmt.Assign;
import tessera.ast.stmt.CodeBlock;
import tessera.ast.stmt.Directive;
import tessera.ast.stmt.For;
import tessera.diag.CompilationAbortedException;
import tessera.diag.Diagnostic;
import tessera.diag.Diagnostics;
import tessera.diag.Severity;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tessera.TestTrees.INT;
import static tessera.TestTrees.intVar;

public class DirectiveProcessorTest {
	private final NodeGraph graph = new NodeGraph(Stage.SEMANTIC);
	private final Diagnostics diagnostics = new Diagnostics();
	private final DirectiveProcessor processor = new DirectiveProcessor(
			DirectiveGrammar.standard().schema(OmpVersion.V4_5), graph, diagnostics);

	private final Variable s = intVar("s");

	private For loop(String index, CodeBlock body) {
		return new For(intVar(index), new Range(Literal.integer(0), intVar("n")), body);
	}

	private For accumulatingLoop() {
		Variable i = intVar("i");
		return graph.add(new For(i, new Range(Literal.integer(0), intVar("n")),
				CodeBlock.of(new Assign(s, new BinaryOp(Operator.ADD, s, i, INT)))));
	}

	@Test
	void attachesAValidatedDirective() {
		For target = accumulatingLoop();

		Directive d = processor.process("#$ omp parallel for reduction(+:s) private(i)", 3, target);

		assertEquals(List.of(d), graph.directives(target));
		assertSame(target, graph.annotatedBy(d));
		assertEquals(3, d.span().line());
		assertTrue(diagnostics.all().isEmpty());
	}

	@Test
	void detachedDirectiveLeavesNoAnnotation() {
		For target = accumulatingLoop();
		Directive first = processor.process("#$ omp parallel for reduction(+:s)", 3, target);
		Directive second = processor.process("#$ omp parallel for reduction(+:s)", 3, target);

		graph.detach(first);

		assertEquals(List.of(second), graph.directives(target));
		assertNull(graph.annotatedBy(first));
		graph.detach(second);
		assertTrue(graph.directives(target).isEmpty());
		assertThrows(StructuralViolationException.class, () -> graph.detach(second));
	}

	@Test
	void loopConstructMustAnnotateALoop() {
		CodeBlock block = graph.add(CodeBlock.of(new Assign(s, Literal.integer(0))));

		assertThrows(CompilationAbortedException.class, () -> processor.process("#$ omp for", 3, block));
		assertEquals(1, diagnostics.fatalCount());
		assertTrue(graph.directives(block).isEmpty());
	}

	@Test
	void syntaxErrorIsReportedAsFatalWithLineAndText() {
		CodeBlock block = graph.add(CodeBlock.of());

		CompilationAbortedException e = assertThrows(CompilationAbortedException.class,
				() -> processor.process("#$ omp parallel bogus", 12, block));

		Diagnostic d = e.diagnostic();
		assertEquals(Severity.FATAL, d.severity());
		assertEquals("invalid directive: unknown clause 'bogus'", d.message());
		assertEquals(12, d.span().line());
		assertEquals("#$ omp parallel bogus", d.symbol());
	}

	@Test
	void collapseNeedsEnoughPerfectlyNestedLoops() {
		For single = accumulatingLoop();
		assertThrows(CompilationAbortedException.class, () -> processor.process("#$ omp for collapse(2)", 1, single));

		For nest = graph.add(loop("i", CodeBlock.of(loop("j", CodeBlock.of(new Assign(s, Literal.integer(1)))))));
		processor.process("#$ omp for collapse(2)", 2, nest);
		assertEquals(1, graph.directives(nest).size());
		assertEquals(2, DirectiveValidator.perfectNestDepth(nest));
	}

	@Test
	void collapseCountMustBeAConstant() {
		For target = accumulatingLoop();

		assertThrows(CompilationAbortedException.class, () -> processor.process("#$ omp for collapse(k)", 1, target));
	}

	@Test
	void endDirectiveNeedsAnOpenBegin() {
		CodeBlock block = graph.add(CodeBlock.of(new Assign(s, Literal.integer(0))));
		assertThrows(CompilationAbortedException.class, () -> processor.process("#$ omp end parallel", 5, block));

		processor.process("#$ omp parallel", 4, block);
		Directive end = processor.process("#$ omp end parallel", 6, block);

		assertTrue(end.isEnd());
		assertEquals(2, graph.directives(block).size());
	}

	@Test
	void unusedDataSharingVariableIsAnError() {
		For target = accumulatingLoop();

		processor.process("#$ omp parallel for private(k)", 3, target);

		assertEquals(1, diagnostics.count(Severity.ERROR));
		assertEquals("k", diagnostics.all().get(0).symbol());
		assertEquals(1, graph.directives(target).size());
	}
}
