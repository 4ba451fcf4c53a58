package tessera.print;

import org.junit.jupiter.api.Test;
import tessera.ast.Node;
import tessera.ast.NodeGraph;
import tessera.ast.SourceSpan;
import tessera.ast.Stage;
import tessera.ast.decl.Decorator;
import tessera.ast.decl.FunctionArgument;
import tessera.ast.decl.FunctionDef;
import tessera.ast.decl.Import;
import tessera.ast.decl.ImportTarget;
import tessera.ast.decl.Module;
import tessera.ast.decl.Program;
import tessera.ast.expr.AllocationKind;
import tessera.ast.expr.ArrayAllocation;
import tessera.ast.expr.BinaryOp;
import tessera.ast.expr.Cast;
import tessera.ast.expr.CombinationMode;
import tessera.ast.expr.Comprehension;
import tessera.ast.expr.IndexedElement;
import tessera.ast.expr.Literal;
import tessera.ast.expr.Operator;
import tessera.ast.expr.Range;
import tessera.ast.expr.TupleLiteral;
import tessera.ast.expr.Variable;
import tessera.ast.stmt.Assign;
import tessera.ast.stmt.CodeBlock;
import tessera.ast.stmt.For;
import tessera.ast.stmt.If;
import tessera.ast.stmt.IfSection;
import tessera.ast.stmt.Print;
import tessera.ast.stmt.Return;
import tessera.ast.stmt.While;
import tessera.diag.CompilationAbortedException;
import tessera.diag.Diagnostics;
import tessera.directive.DirectiveGrammar;
import tessera.directive.DirectiveProcessor;
import tessera.directive.OmpVersion;
import tessera.types.ElementKind;
import tessera.types.MemoryOrder;
import tessera.types.Precision;
import tessera.types.TypeDescriptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tessera.TestTrees.BOOL;
import static tessera.TestTrees.FLOAT;
import static tessera.TestTrees.INT;
import static tessera.TestTrees.floatArrayVar;
import static tessera.TestTrees.floatVar;
import static tessera.TestTrees.intVar;
import static tessera.TestTrees.normalize;

public class PythonPrinterTest {
	private final NodeGraph graph = new NodeGraph(Stage.SEMANTIC);
	private final Diagnostics diagnostics = new Diagnostics();
	private final PythonPrinter printer = new PythonPrinter(graph, diagnostics, 4);

	private String print(Node root) {
		return printer.print(graph.add(root));
	}

	@Test
	void defaultPrecisionLiteralsPrintBare() {
		assertEquals("3", print(Literal.integer(3)));
		assertEquals("1.5", print(Literal.floating("1.5")));
		assertEquals("True", print(Literal.bool(true)));
		assertEquals("'it\\'s'", print(Literal.string("it's")));
		assertEquals("(1.0+2.0j)", print(Literal.complex("1.0", "2.0")));
		assertEquals("(1.0-2.0j)", print(Literal.complex("1.0", "-2.0")));
		assertTrue(printer.imports().synthesized().isEmpty());
	}

	@Test
	void explicitPrecisionPrintsAConstructor() {
		assertEquals("int32(3)", print(Literal.integer(3, 32)));
		assertEquals("float(1.5)", print(Literal.floating("1.5", 64)));
		assertEquals("float32(1.5)", print(Literal.floating("1.5", 32)));

		assertEquals(List.of(new ImportEntry("numpy", "int32", null), new ImportEntry("numpy", "float32", null)),
				printer.imports().synthesized());
	}

	@Test
	void castsUseTheCastTable() {
		Variable x = floatVar("x");

		assertEquals("int32(x)", print(new Cast(ElementKind.INTEGER, Precision.ofBits(32), x)));
		assertEquals("x", print(new Cast(ElementKind.FLOAT, Precision.ofBits(64), x)));
		assertEquals("int(x)", print(new Cast(ElementKind.INTEGER, Precision.DEFAULT, x)));
	}

	@Test
	void printsAFunction() {
		Variable x = intVar("x");
		Variable y = floatVar("y");
		Variable r = floatVar("r");
		FunctionDef f = FunctionDef.builder("f")
				.argument(x)
				.argument(new FunctionArgument(y, "float", Literal.floating("0.5"), SourceSpan.NONE))
				.result(r)
				.body(CodeBlock.of(new Assign(r, new BinaryOp(Operator.ADD, x, y, FLOAT)), new Return(List.of(r))))
				.build();

		assertEquals(normalize("def f(x, y: float = 0.5):\n    r = x + y\n    return r\n\n"), normalize(print(f)));
	}

	@Test
	void reservedNamesAreRenamed() {
		Variable v = intVar("lambda");
		FunctionDef g = FunctionDef.builder("g").argument(v).body(CodeBlock.of(new Return(List.of(v)))).build();

		assertEquals("def g(lambda_0000):\n    return lambda_0000\n\n", print(g));
	}

	@Test
	void emptyBodyPrintsPass() {
		assertEquals("while flag:\n    pass\n", print(new While(new Variable("flag", BOOL), CodeBlock.of())));
	}

	@Test
	void printsIfElifElse() {
		Variable x = intVar("x");
		Variable y = intVar("y");
		If branch = new If(List.of(
				new IfSection(new BinaryOp(Operator.GT, x, Literal.integer(0), BOOL),
						CodeBlock.of(new Assign(y, Literal.integer(1)))),
				new IfSection(new BinaryOp(Operator.LT, x, Literal.integer(0), BOOL),
						CodeBlock.of(new Assign(y, Literal.integer(2)))),
				new IfSection(Literal.bool(true), CodeBlock.of(new Assign(y, Literal.integer(3))))));

		assertEquals("if x > 0:\n    y = 1\nelif x < 0:\n    y = 2\nelse:\n    y = 3\n", print(branch));
	}

	@Test
	void decoratorsPrintMostRecentFirstAndAreImported() {
		FunctionDef k = FunctionDef.builder("k")
				.decorate(Decorator.kernel())
				.decorate(Decorator.types("int", "float"))
				.build();

		assertEquals("@types('int', 'float')\n@kernel\ndef k():\n    pass\n\n", print(k));
		assertEquals(List.of(new ImportEntry("tessera.decorators", "types", null),
				new ImportEntry("tessera.decorators", "kernel", null)), printer.imports().synthesized());
	}

	@Test
	void templateDecoratorListsItsTypes() {
		FunctionDef t = FunctionDef.builder("t").decorate(Decorator.template("T", "int", "float")).build();

		assertEquals("@template(name='T', types=['int', 'float'])\ndef t():\n    pass\n\n", print(t));
	}

	@Test
	void allocationNamesShapeTypeAndOrder() {
		Variable n = intVar("n");
		Variable m = intVar("m");
		TypeDescriptor type = TypeDescriptor.array(ElementKind.FLOAT, Precision.ofBits(32), 2, MemoryOrder.COLUMN_MAJOR);
		Variable a = new Variable("a", type);

		assertEquals("a = zeros((n, m), dtype=float32, order='F')\n",
				print(new Assign(a, new ArrayAllocation(AllocationKind.ZEROS, List.of(n, m), type))));
	}

	@Test
	void differentMemoryOrderTransposes() {
		Variable a = floatArrayVar("a", 2, MemoryOrder.ROW_MAJOR);
		Variable b = floatArrayVar("b", 2, MemoryOrder.COLUMN_MAJOR);

		assertEquals("b = a.T\n", print(new Assign(b, a)));
	}

	@Test
	void singleElementTupleKeepsItsComma() {
		assertEquals("(1,)", print(new TupleLiteral(List.of(Literal.integer(1)), INT)));
	}

	@Test
	void collectingComprehensionBuildsAnArray() {
		Variable i = intVar("i");
		Variable a = floatArrayVar("a", 1, MemoryOrder.ROW_MAJOR);
		Node nest = new For(i, new Range(Literal.integer(0), intVar("n")), CodeBlock.of(
				new Assign(new IndexedElement(a, List.of(i), FLOAT, SourceSpan.NONE),
						new BinaryOp(Operator.MUL, i, i, INT))));

		String out = print(new Comprehension(CombinationMode.COLLECT, List.of(), nest, a, List.of(i), null,
				a.type(), SourceSpan.NONE));

		assertEquals("a = array([i * i for i in range(0, n)])\n", out);
		assertEquals(List.of(new ImportEntry("numpy", "array", null)), printer.imports().synthesized());
	}

	@Test
	void reductionsPrintAGeneratorAndNestInline() {
		Variable i = intVar("i");
		Variable j = intVar("j");
		Variable acc = intVar("s");
		Variable innerAcc = intVar("t");
		Comprehension inner = new Comprehension(CombinationMode.SUM, List.of(new Assign(innerAcc, Literal.integer(0))),
				new For(j, new Range(Literal.integer(0), i), CodeBlock.of(
						new Assign(innerAcc, new BinaryOp(Operator.ADD, innerAcc, j, INT)))),
				innerAcc, List.of(j), innerAcc, INT, SourceSpan.NONE);
		Comprehension outer = new Comprehension(CombinationMode.SUM, List.of(new Assign(acc, Literal.integer(0))),
				new For(i, new Range(Literal.integer(0), intVar("n")), CodeBlock.of(inner,
						new Assign(acc, new BinaryOp(Operator.ADD, acc, innerAcc, INT)))),
				acc, List.of(i), acc, INT, SourceSpan.NONE);

		assertEquals("s = sum(sum(j for j in range(0, i)) for i in range(0, n))\n", print(outer));
	}

	@Test
	void directivesWrapTheAnnotatedLoop() {
		Variable i = intVar("i");
		Variable s = intVar("s");
		For loop = graph.add(new For(i, new Range(Literal.integer(0), intVar("n")),
				CodeBlock.of(new Assign(s, new BinaryOp(Operator.ADD, s, i, INT)))));
		new DirectiveProcessor(DirectiveGrammar.standard().schema(OmpVersion.V4_5), graph, diagnostics)
				.process("#$ omp parallel for reduction(+:s)", 1, loop);

		assertEquals("#$ omp parallel for reduction(+:s)\nfor i in range(0, n):\n    s = s + i\n", printer.print(loop));
	}

	@Test
	void moduleListsWrittenThenSynthesizedImports() {
		Variable x = floatVar("x");
		FunctionDef half = FunctionDef.builder("half")
				.argument(x)
				.body(CodeBlock.of(new Return(List.of(new Cast(ElementKind.FLOAT, Precision.ofBits(32), x)))))
				.build();
		Module module = Module.builder("demo")
				.imports(new Import("math", ImportTarget.of("sqrt")))
				.function(half)
				.program(new Program("demo", CodeBlock.of(new Print(List.of(Literal.string("hi"))))))
				.build();

		assertEquals("from math import sqrt\nfrom numpy import float32\n\n"
				+ "def half(x):\n    return float32(x)\n\n"
				+ "if __name__ == \"__main__\":\n    print('hi')\n\n", print(module));
	}

	@Test
	void narrowingAssignmentWithoutCastIsFatal() {
		Variable n = intVar("n");

		assertThrows(CompilationAbortedException.class, () -> print(new Assign(n, Literal.floating("1.5"))));
		assertEquals(1, diagnostics.fatalCount());
		assertTrue(diagnostics.all().get(0).message().startsWith("type mismatch"));
	}
}
