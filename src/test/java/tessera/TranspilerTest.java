package tessera;

import org.junit.jupiter.api.Test;
import tessera.ast.NodeGraph;
import tessera.ast.SourceSpan;
import tessera.ast.Stage;
import tessera.ast.decl.FunctionDef;
import tessera.ast.decl.Module;
import tessera.ast.expr.BinaryOp;
import tessera.ast.expr.CombinationMode;
import tessera.ast.expr.Comprehension;
import tessera.ast.expr.Literal;
import tessera.ast.expr.Operator;
import tessera.ast.expr.Range;
import tessera.ast.expr.Variable;
import tessera.ast.stmt.Assign;
import tessera.ast.stmt.CodeBlock;
import tessera.ast.stmt.For;
import tessera.ast.stmt.Return;
import tessera.diag.Severity;
import tessera.directive.OmpVersion;
import tessera.print.Target;

import java.io.IOException;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tessera.TestTrees.INT;
import static tessera.TestTrees.intVar;

public class TranspilerTest {
	private final NodeGraph graph = new NodeGraph(Stage.SEMANTIC);
	private final Variable s = intVar("s");
	private final Variable i = intVar("i");
	private final For loop = new For(i, new Range(Literal.integer(0), intVar("n")),
			CodeBlock.of(new Assign(s, new BinaryOp(Operator.ADD, s, Literal.integer(1), INT))));
	private final CodeBlock body = CodeBlock.of(loop);
	private final Module module = graph.add(Module.builder("counter")
			.function(FunctionDef.builder("count").local(s).local(i).body(body).build())
			.build());

	private static TranspilerConfig config(String key, String value) {
		Properties properties = new Properties();
		properties.setProperty(key, value);
		return new TranspilerConfig(properties);
	}

	@Test
	void compilesWithoutDirectives() {
		CompilationResult result = new Transpiler().compile(new CompilationUnit("counter", graph, module));

		assertTrue(result.complete());
		assertEquals("def count():\n    for i in range(0, n):\n        s = s + 1\n\n", result.text());
		assertEquals(0, result.diagnostics().all().size());
	}

	@Test
	void fatalDirectiveDiscardsOutput() {
		CompilationResult result = new Transpiler().compile(new CompilationUnit("counter", graph, module,
				List.of(new PendingDirective("#$ omp parallel for", 4, body))));

		assertFalse(result.complete());
		assertEquals("", result.text());
		assertEquals(1, result.diagnostics().fatalCount());
		assertTrue(result.imports().isEmpty());
	}

	@Test
	void directiveVersionComesFromConfiguration() {
		List<PendingDirective> pending = List.of(new PendingDirective("#$ omp loop", 4, loop));

		CompilationResult v50 = new Transpiler(config("openmp.version", "5.0"))
				.compile(new CompilationUnit("counter", graph, module, pending));
		assertTrue(v50.complete(), () -> v50.diagnostics().all().toString());
		assertTrue(v50.text().contains("    #$ omp loop\n    for i in range(0, n):\n"));

		NodeGraph other = new NodeGraph(Stage.SEMANTIC);
		For again = new For(intVar("i"), new Range(Literal.integer(0), intVar("n")), CodeBlock.of());
		Module older = other.add(Module.builder("older")
				.function(FunctionDef.builder("f").body(CodeBlock.of(again)).build())
				.build());
		CompilationResult v45 = new Transpiler(config("openmp.version", "4.5"))
				.compile(new CompilationUnit("older", other, older, List.of(new PendingDirective("#$ omp loop", 2, again))));
		assertFalse(v45.complete());
		assertTrue(v45.diagnostics().all().get(0).message().startsWith("invalid directive"));
	}

	@Test
	void unusedPrivateVariableIsReportedButNotFatal() {
		CompilationResult result = new Transpiler().compile(new CompilationUnit("counter", graph, module,
				List.of(new PendingDirective("#$ omp parallel for private(k)", 4, loop))));

		assertTrue(result.complete());
		assertEquals(1, result.diagnostics().count(Severity.ERROR));
	}

	@Test
	void compilesToC() {
		CompilationResult result = new Transpiler(config("target", "c"))
				.compile(new CompilationUnit("counter", graph, module));

		assertTrue(result.complete(), () -> result.diagnostics().all().toString());
		assertEquals("#include <stdint.h>\n\nvoid count(void)\n{\n    int64_t s;\n    int64_t i;\n\n"
				+ "    for (i = 0; i < n; i += 1)\n    {\n        s = s + 1;\n    }\n}\n\n", result.text());
	}

	@Test
	void compilingTwiceGivesTheSameText() {
		CompilationUnit unit = new CompilationUnit("counter", graph, module,
				List.of(new PendingDirective("#$ omp parallel for", 4, loop)));
		Transpiler transpiler = new Transpiler();

		CompilationResult first = transpiler.compile(unit);
		CompilationResult second = transpiler.compile(unit);

		assertTrue(second.complete(), () -> second.diagnostics().all().toString());
		assertEquals(first.text(), second.text());
		assertEquals(1, second.text().split("#\\$ omp parallel for", -1).length - 1);
		assertTrue(graph.directives(loop).isEmpty());
	}

	@Test
	void unitCanBeRecompiledUnderAnotherVersion() {
		CompilationUnit unit = new CompilationUnit("counter", graph, module,
				List.of(new PendingDirective("#$ omp loop", 4, loop)));

		assertTrue(new Transpiler(config("openmp.version", "5.0")).compile(unit).complete());
		CompilationResult older = new Transpiler(config("openmp.version", "4.5")).compile(unit);

		assertFalse(older.complete());
		assertEquals("", older.text());
		assertTrue(graph.directives(loop).isEmpty());
	}

	@Test
	void sameGraphPrintsAsPythonThenAsC() {
		NodeGraph shared = new NodeGraph(Stage.SEMANTIC);
		Variable n = intVar("n");
		Variable total = intVar("s");
		Variable outerIndex = intVar("i");
		Variable innerIndex = intVar("j");
		Variable partial = intVar("t");
		Comprehension inner = new Comprehension(CombinationMode.SUM, List.of(new Assign(partial, Literal.integer(0))),
				new For(innerIndex, new Range(Literal.integer(0), outerIndex), CodeBlock.of(
						new Assign(partial, new BinaryOp(Operator.ADD, partial, innerIndex, INT)))),
				partial, List.of(innerIndex), partial, INT, SourceSpan.NONE);
		Comprehension outer = new Comprehension(CombinationMode.SUM, List.of(new Assign(total, Literal.integer(0))),
				new For(outerIndex, new Range(Literal.integer(0), n), CodeBlock.of(inner,
						new Assign(total, new BinaryOp(Operator.ADD, total, partial, INT)))),
				total, List.of(outerIndex), total, INT, SourceSpan.NONE);
		Module sums = shared.add(Module.builder("sums")
				.function(FunctionDef.builder("f")
						.argument(n)
						.result(total)
						.local(outerIndex)
						.local(innerIndex)
						.local(partial)
						.body(CodeBlock.of(outer, new Return(List.of(total))))
						.build())
				.build());
		CompilationUnit unit = new CompilationUnit("sums", shared, sums);

		CompilationResult python = new Transpiler().compile(unit);
		CompilationResult c = new Transpiler(config("target", "c")).compile(unit);

		assertTrue(python.complete(), () -> python.diagnostics().all().toString());
		assertEquals("def f(n):\n    s = sum(sum(j for j in range(0, i)) for i in range(0, n))\n    return s\n\n",
				python.text());
		assertTrue(c.complete(), () -> c.diagnostics().all().toString());
		assertEquals("#include <stdint.h>\n\nint64_t f(int64_t n)\n{\n"
				+ "    int64_t s;\n    int64_t i;\n    int64_t j;\n    int64_t t;\n\n"
				+ "    s = 0;\n"
				+ "    for (i = 0; i < n; i += 1)\n    {\n"
				+ "        t = 0;\n"
				+ "        for (j = 0; j < i; j += 1)\n        {\n            t = t + j;\n        }\n"
				+ "        s = s + t;\n"
				+ "    }\n"
				+ "    return s;\n}\n\n", c.text());
	}

	@Test
	void directiveOnForeignNodeIsAnInternalError() {
		For stray = new For(intVar("j"), new Range(Literal.integer(0), intVar("n")), CodeBlock.of());

		CompilationResult result = new Transpiler().compile(new CompilationUnit("counter", graph, module,
				List.of(new PendingDirective("#$ omp parallel for", 7, stray))));

		assertFalse(result.complete());
		assertTrue(result.diagnostics().all().get(0).message().startsWith("internal error:"));
	}

	@Test
	void rootMustBelongToTheGraph() {
		Module loose = Module.builder("loose").build();

		assertThrows(IllegalArgumentException.class, () -> new CompilationUnit("loose", graph, loose));
	}

	@Test
	void configurationDefaultsAndOverrides() throws IOException {
		TranspilerConfig defaults = TranspilerConfig.defaults();
		assertEquals(Target.PYTHON, defaults.target());
		assertEquals(OmpVersion.V4_5, defaults.openmpVersion());
		assertEquals(4, defaults.indentWidth());

		TranspilerConfig loaded = TranspilerConfig.load();
		assertEquals(Target.PYTHON, loaded.target());

		assertEquals(Target.C, config("target", "c").target());
		assertEquals(2, config("indent.width", "2").indentWidth());
		assertThrows(IllegalArgumentException.class, () -> config("indent.width", "0"));
		assertThrows(IllegalArgumentException.class, () -> config("openmp.version", "3.0"));
		assertThrows(IllegalArgumentException.class, () -> config("target", "fortran"));
	}
}
