package tessera.print;

import tessera.ast.Node;
import tessera.ast.NodeGraph;
import tessera.ast.decl.ClassDef;
import tessera.ast.decl.Decorator;
import tessera.ast.decl.DecoratorKind;
import tessera.ast.decl.FunctionArgument;
import tessera.ast.decl.FunctionDef;
import tessera.ast.decl.Import;
import tessera.ast.decl.Interface;
import tessera.ast.decl.Module;
import tessera.ast.decl.Program;
import tessera.ast.expr.ArrayAllocation;
import tessera.ast.expr.ArrayShapeElement;
import tessera.ast.expr.ArraySize;
import tessera.ast.expr.AttributeAccess;
import tessera.ast.expr.BinaryOp;
import tessera.ast.expr.CallArgument;
import tessera.ast.expr.Cast;
import tessera.ast.expr.Comprehension;
import tessera.ast.expr.Elemental;
import tessera.ast.expr.FunctionCall;
import tessera.ast.expr.IndexedElement;
import tessera.ast.expr.LibraryCall;
import tessera.ast.expr.ListLiteral;
import tessera.ast.expr.Literal;
import tessera.ast.expr.Nil;
import tessera.ast.expr.Operator;
import tessera.ast.expr.Parenthesis;
import tessera.ast.expr.Range;
import tessera.ast.expr.Slice;
import tessera.ast.expr.Symbol;
import tessera.ast.expr.TernaryOp;
import tessera.ast.expr.TupleLiteral;
import tessera.ast.expr.UnaryOp;
import tessera.ast.expr.UnaryOperator;
import tessera.ast.expr.Variable;
import tessera.ast.stmt.AliasAssign;
import tessera.ast.stmt.Assign;
import tessera.ast.stmt.AugAssign;
import tessera.ast.stmt.Break;
import tessera.ast.stmt.CodeBlock;
import tessera.ast.stmt.Comment;
import tessera.ast.stmt.CommentBlock;
import tessera.ast.stmt.Continue;
import tessera.ast.stmt.Del;
import tessera.ast.stmt.Directive;
import tessera.ast.stmt.For;
import tessera.ast.stmt.If;
import tessera.ast.stmt.IfSection;
import tessera.ast.stmt.KernelCall;
import tessera.ast.stmt.Pass;
import tessera.ast.stmt.Print;
import tessera.ast.stmt.Return;
import tessera.ast.stmt.While;
import tessera.diag.Diagnostics;
import tessera.scope.ScopeManager;
import tessera.types.ElementKind;
import tessera.types.MemoryOrder;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BinaryOperator;

/**
 * Prints the tree as C99 against the {@code ndarrays.h} runtime.
 *
 * Arrays are {@code t_ndarray} values; elemental expressions assigned to an
 * array expand into an explicit loop nest. Locals are declared at the top of
 * their function, and nested functions are hoisted in front of it.
 */
public final class CPrinter extends CodePrinter {
	static final String NDARRAYS = "\"ndarrays.h\"";

	private static final Set<String> IGNORED_SOURCES = Set.of(
			"numpy", "numpy.random", "math", PythonPrinter.DECORATORS_MODULE);

	private static final Map<String, String> MATH = Map.ofEntries(
			Map.entry("sqrt", "sqrt"),
			Map.entry("exp", "exp"),
			Map.entry("log", "log"),
			Map.entry("log10", "log10"),
			Map.entry("sin", "sin"),
			Map.entry("cos", "cos"),
			Map.entry("tan", "tan"),
			Map.entry("sinh", "sinh"),
			Map.entry("cosh", "cosh"),
			Map.entry("tanh", "tanh"),
			Map.entry("arcsin", "asin"),
			Map.entry("arccos", "acos"),
			Map.entry("arctan", "atan"),
			Map.entry("arcsinh", "asinh"),
			Map.entry("arccosh", "acosh"),
			Map.entry("arctanh", "atanh"),
			Map.entry("asin", "asin"),
			Map.entry("acos", "acos"),
			Map.entry("atan", "atan"),
			Map.entry("arctan2", "atan2"),
			Map.entry("atan2", "atan2"),
			Map.entry("hypot", "hypot"),
			Map.entry("floor", "floor"),
			Map.entry("ceil", "ceil"),
			Map.entry("trunc", "trunc"),
			Map.entry("power", "pow"),
			Map.entry("pow", "pow"));

	// functions that have a complex counterpart in complex.h
	private static final Set<String> COMPLEX_MATH = Set.of(
			"sqrt", "exp", "log", "sin", "cos", "tan", "sinh", "cosh", "tanh",
			"asin", "acos", "atan", "asinh", "acosh", "atanh", "pow");

	private final CastTable casts = CastTable.c();
	private final CastTable tags = CastTable.cArrayTags();
	// loop indices while printing one element of an array expression
	private List<String> elementIndices;
	// node currently printed as a statement of a block
	private Node statementNode;

	public CPrinter(NodeGraph graph, Diagnostics diagnostics, int indentWidth) {
		super(graph, diagnostics, indentWidth);
	}

	@Override
	public Target target() {
		return Target.C;
	}

	@Override
	protected NameSwaps nameSwaps() {
		return NameSwaps.none();
	}

	// ---------------------------------------------------------------- types

	private String cType(TypeDescriptor type, Node at) {
		if (type.rank() > 0) {
			imports.include(NDARRAYS);
			return "t_ndarray";
		}
		CastTable.Entry entry = casts.lookup(type.kind(), type.precision());
		if (entry == null) {
			throw unsupported(at, "type " + type);
		}
		if (entry.module() != null) {
			imports.include(entry.module());
		}
		return entry.name();
	}

	private String tag(TypeDescriptor type, Node at) {
		CastTable.Entry entry = tags.lookup(type.kind(), type.precision());
		if (entry == null) {
			throw unsupported(at, "array of " + type.element());
		}
		return entry.name();
	}

	private static ElementKind kindOf(Node node) {
		return node instanceof TypedValue value ? value.type().kind() : null;
	}

	private static TypeDescriptor typeOf(Node node) {
		return node instanceof TypedValue value ? value.type() : null;
	}

	private String declarations(List<Variable> variables) {
		StringBuilder out = new StringBuilder();
		for (Variable v : variables) {
			out.append(cType(v.type(), v)).append(' ').append(name(v));
			if (v.type().rank() > 0) {
				out.append(" = {.shape = NULL}");
			}
			out.append(";\n");
		}
		return out.toString();
	}

	/** Prints an array operand by name, never as one of its elements. */
	private String arrayName(Node array) {
		if (array instanceof Variable v) {
			return name(v);
		}
		return print(array);
	}

	// ---------------------------------------------------------------- expressions

	@Override
	public String visitVariable(Variable node) {
		int rank = node.type().rank();
		if (elementIndices != null && rank > 0) {
			// broadcasting aligns a lower-rank operand with the trailing axes
			int size = elementIndices.size();
			if (rank > size) {
				throw unsupported(node, "operand of higher rank than the assigned array");
			}
			return element(name(node), node.type(), elementIndices.subList(size - rank, size), node);
		}
		return name(node);
	}

	private String element(String array, TypeDescriptor type, List<String> indices, Node at) {
		imports.include(NDARRAYS);
		return "GET_ELEMENT(" + array + ", " + tag(type, at) + ", " + String.join(", ", indices) + ")";
	}

	@Override
	public String visitLiteral(Literal node) {
		TypeDescriptor type = node.type();
		switch (type.kind()) {
			case BOOL:
				imports.include("<stdbool.h>");
				return node.isTrue() ? "true" : "false";
			case STRING:
				return "\"" + escape(node.value()) + "\"";
			case COMPLEX:
				imports.include("<complex.h>");
				String complex = "(" + node.value() + " + " + node.imaginary() + " * _Complex_I)";
				return type.precision().isDefault() ? complex : "(" + cType(type, node) + ")" + complex;
			default:
				if (type.precision().isDefault()) {
					return node.value();
				}
				return "(" + cType(type, node) + ")" + node.value();
		}
	}

	private static String escape(String s) {
		return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
	}

	@Override
	public String visitSymbol(Symbol node) {
		return node.name();
	}

	@Override
	public String visitBinaryOp(BinaryOp node) {
		List<Node> args = node.args();
		Operator op = node.op();
		ElementKind result = node.type().kind();
		switch (op) {
			case DIV:
				if (allIntegral(args)) {
					return fold(args, (a, b) -> "(double)(" + a + ") / (double)(" + b + ")");
				}
				break;
			case FLOOR_DIV:
				imports.include("<math.h>");
				String floor = fold(args, (a, b) -> "floor((double)(" + a + ") / (double)(" + b + "))");
				return result == ElementKind.INTEGER ? "(int64_t)" + floor : floor;
			case POW:
				if (result == ElementKind.COMPLEX) {
					imports.include("<complex.h>");
					return fold(args, (a, b) -> "cpow(" + a + ", " + b + ")");
				}
				imports.include("<math.h>");
				String pow = fold(args, (a, b) -> "pow(" + a + ", " + b + ")");
				return result == ElementKind.INTEGER ? "(int64_t)" + pow : pow;
			case MOD:
				if (result == ElementKind.FLOAT) {
					imports.include("<math.h>");
					return fold(args, (a, b) -> "fmod(" + a + ", " + b + ")");
				}
				break;
			default:
				break;
		}
		return join(" " + op.c() + " ", args);
	}

	private static boolean allIntegral(List<Node> args) {
		for (Node a : args) {
			ElementKind kind = kindOf(a);
			if (kind != ElementKind.INTEGER && kind != ElementKind.BOOL) {
				return false;
			}
		}
		return true;
	}

	private String fold(List<Node> args, BinaryOperator<String> combine) {
		String acc = print(args.get(0));
		for (int i = 1; i < args.size(); i++) {
			acc = combine.apply(acc, print(args.get(i)));
		}
		return acc;
	}

	@Override
	public String visitUnaryOp(UnaryOp node) {
		return node.op().c() + print(node.arg());
	}

	@Override
	public String visitParenthesis(Parenthesis node) {
		return "(" + print(node.arg()) + ")";
	}

	@Override
	public String visitTernaryOp(TernaryOp node) {
		return "(" + print(node.condition()) + " ? " + print(node.ifTrue()) + " : " + print(node.ifFalse()) + ")";
	}

	@Override
	public String visitCast(Cast node) {
		Node arg = node.arg();
		TypeDescriptor to = node.type();
		if (!((TypedValue) arg).requiresCast(to.kind(), to.precision())) {
			return print(arg);
		}
		if (to.rank() > 0 && elementIndices == null) {
			throw unsupported(node, "array cast outside an assignment");
		}
		return "(" + cType(to.element(), node) + ")(" + print(arg) + ")";
	}

	@Override
	public String visitIndexedElement(IndexedElement node) {
		if (node.isSliced()) {
			throw unsupported(node, "array slice");
		}
		TypeDescriptor base = typeOf(node.base());
		if (base == null || base.rank() == 0) {
			throw unsupported(node, "indexing a non-array value");
		}
		List<String> indices = new ArrayList<>();
		for (Node index : node.indices()) {
			indices.add(print(index));
		}
		return element(arrayName(node.base()), base, indices, node);
	}

	@Override
	public String visitSlice(Slice node) {
		throw unsupported(node, "array slice");
	}

	@Override
	public String visitAttributeAccess(AttributeAccess node) {
		throw unsupported(node, "attribute access");
	}

	@Override
	public String visitFunctionCall(FunctionCall node) {
		if (node.receiver() != null) {
			throw unsupported(node, "method call");
		}
		return node.name() + "(" + join(", ", node.args()) + ")";
	}

	@Override
	public String visitCallArgument(CallArgument node) {
		if (node.keyword() != null) {
			throw unsupported(node, "keyword argument");
		}
		return print(node.value());
	}

	@Override
	public String visitLibraryCall(LibraryCall node) {
		String canonical = node.function().canonicalName();
		List<Node> args = node.args();
		ElementKind argKind = args.isEmpty() ? null : kindOf(args.get(0));
		switch (canonical) {
			case "abs":
			case "absolute":
			case "fabs":
				return abs(node, argKind);
			case "min":
			case "max":
			case "amin":
			case "amax":
				return minMax(node, canonical.endsWith("min"));
			default:
				break;
		}
		String name = MATH.get(canonical);
		if (name == null) {
			throw unsupported(node, "function " + canonical);
		}
		if (argKind == ElementKind.COMPLEX) {
			if (!COMPLEX_MATH.contains(name)) {
				throw unsupported(node, "complex " + canonical);
			}
			imports.include("<complex.h>");
			return "c" + name + "(" + join(", ", args) + ")";
		}
		imports.include("<math.h>");
		return name + "(" + join(", ", args) + ")";
	}

	private String abs(LibraryCall node, ElementKind argKind) {
		String arg = join(", ", node.args());
		if (argKind == ElementKind.COMPLEX) {
			imports.include("<complex.h>");
			return "cabs(" + arg + ")";
		}
		if (argKind == ElementKind.INTEGER) {
			imports.include("<stdlib.h>");
			return "labs(" + arg + ")";
		}
		imports.include("<math.h>");
		return "fabs(" + arg + ")";
	}

	private String minMax(LibraryCall node, boolean min) {
		List<Node> args = node.args();
		if (args.size() != 2) {
			throw unsupported(node, (min ? "min" : "max") + " of " + args.size() + " values");
		}
		String a = print(args.get(0));
		String b = print(args.get(1));
		if (node.type().kind() == ElementKind.FLOAT) {
			imports.include("<math.h>");
			return (min ? "fmin(" : "fmax(") + a + ", " + b + ")";
		}
		return "(" + a + (min ? " < " : " > ") + b + " ? " + a + " : " + b + ")";
	}

	@Override
	public String visitArraySize(ArraySize node) {
		return arrayName(node.array()) + ".length";
	}

	@Override
	public String visitArrayShapeElement(ArrayShapeElement node) {
		return arrayName(node.array()) + ".shape[" + print(node.index()) + "]";
	}

	@Override
	public String visitArrayAllocation(ArrayAllocation node) {
		throw unsupported(node, "array allocation outside an assignment");
	}

	@Override
	public String visitRange(Range node) {
		throw unsupported(node, "range outside a for loop");
	}

	@Override
	public String visitTupleLiteral(TupleLiteral node) {
		throw unsupported(node, "tuple");
	}

	@Override
	public String visitListLiteral(ListLiteral node) {
		throw unsupported(node, "list");
	}

	@Override
	public String visitNil(Nil node) {
		return "NULL";
	}

	/** The setup statements, then the loop nest as written; only valid as a statement. */
	@Override
	public String visitComprehension(Comprehension node) {
		if (node != statementNode) {
			throw unsupported(node, "comprehension used as a value");
		}
		StringBuilder out = new StringBuilder();
		for (Node stmt : node.setup()) {
			out.append(statement(stmt));
		}
		out.append(statement(node.loopNest()));
		return out.toString();
	}

	// ---------------------------------------------------------------- statements

	private String statement(Node stmt) {
		Node enclosing = statementNode;
		statementNode = stmt;
		String code;
		try {
			code = print(stmt);
		} finally {
			statementNode = enclosing;
		}
		if (stmt instanceof FunctionCall || stmt instanceof LibraryCall) {
			return code + ";\n";
		}
		if (!code.isEmpty() && !code.endsWith("\n")) {
			return code + "\n";
		}
		return code;
	}

	@Override
	public String visitAssign(Assign node) {
		Node lhs = node.lhs();
		Node rhs = node.rhs();
		checkAssignable(lhs, rhs);
		if (lhs instanceof Variable target && target.type().rank() > 0) {
			if (rhs instanceof ArrayAllocation allocation) {
				return allocate(target, allocation);
			}
			return elementwise(target, "=", rhs);
		}
		return print(lhs) + " = " + print(rhs) + ";\n";
	}

	private String allocate(Variable target, ArrayAllocation allocation) {
		imports.include(NDARRAYS);
		TypeDescriptor type = target.type();
		String order = type.order() == MemoryOrder.COLUMN_MAJOR ? "order_f" : "order_c";
		String array = name(target);
		StringBuilder out = new StringBuilder();
		out.append(array).append(" = array_create(").append(allocation.shape().size())
				.append(", (int64_t[]){").append(join(", ", allocation.shape())).append("}, ")
				.append(tag(type, target)).append(", false, ").append(order).append(");\n");
		switch (allocation.allocation()) {
			case ZEROS:
				out.append("array_fill(0, ").append(array).append(");\n");
				break;
			case ONES:
				out.append("array_fill(1, ").append(array).append(");\n");
				break;
			case FULL:
				out.append("array_fill(").append(print(allocation.fill())).append(", ").append(array).append(");\n");
				break;
			default:
				break;
		}
		return out.toString();
	}

	/**
	 * Expands {@code target op rhs} over every element of {@code target}. The
	 * right-hand side must be built from elemental operations only.
	 */
	private String elementwise(Variable target, String op, Node rhs) {
		if (!isElementwise(rhs)) {
			throw unsupported(rhs, "non-elemental array expression");
		}
		imports.include("<stdint.h>");
		int rank = target.type().rank();
		List<String> indices = new ArrayList<>(rank);
		for (int d = 0; d < rank; d++) {
			indices.add(scopes.freshName("i"));
		}
		String array = name(target);
		String value;
		List<String> saved = elementIndices;
		elementIndices = indices;
		try {
			value = print(rhs);
		} finally {
			elementIndices = saved;
		}
		String code = element(array, target.type(), indices, target) + " " + op + " " + value + ";\n";
		for (int d = rank - 1; d >= 0; d--) {
			String i = indices.get(d);
			code = "for (int64_t " + i + " = 0; " + i + " < " + array + ".shape[" + d + "]; " + i + " += 1)\n{\n"
					+ indent(code) + "}\n";
		}
		return code;
	}

	private static boolean isElementwise(Node node) {
		if (node instanceof Variable || node instanceof Literal || node instanceof Symbol) {
			return true;
		}
		if (node instanceof Elemental e && !e.isElemental()) {
			return false;
		}
		if (node instanceof Elemental || node instanceof BinaryOp || node instanceof UnaryOp
				|| node instanceof Parenthesis || node instanceof TernaryOp || node instanceof CallArgument) {
			for (Node child : node.ownedChildren()) {
				if (!isElementwise(child)) {
					return false;
				}
			}
			return true;
		}
		return false;
	}

	@Override
	public String visitAliasAssign(AliasAssign node) {
		Variable lhs = node.lhs();
		TypeDescriptor source = typeOf(node.rhs());
		if (lhs.type().rank() == 0) {
			return name(lhs) + " = " + print(node.rhs()) + ";\n";
		}
		imports.include(NDARRAYS);
		String rhs = arrayName(node.rhs());
		if (source != null && source.rank() > 1 && source.order() != lhs.type().order()) {
			return "transpose_alias_assign(&" + name(lhs) + ", " + rhs + ");\n";
		}
		return "alias_assign(&" + name(lhs) + ", " + rhs + ");\n";
	}

	@Override
	public String visitAugAssign(AugAssign node) {
		checkAssignable(node.lhs(), node.rhs());
		Operator op = node.op();
		if (op.c() == null || op == Operator.AND || op == Operator.OR) {
			throw unsupported(node, "augmented " + op.python());
		}
		if (node.lhs() instanceof Variable target && target.type().rank() > 0) {
			return elementwise(target, op.c() + "=", node.rhs());
		}
		return print(node.lhs()) + " " + op.c() + "= " + print(node.rhs()) + ";\n";
	}

	/** Statements in order; braced when a region directive is attached to the block. */
	@Override
	public String visitCodeBlock(CodeBlock node) {
		StringBuilder out = new StringBuilder();
		for (Node stmt : node.body()) {
			out.append(statement(stmt));
		}
		for (Directive d : graph.directives(node)) {
			if (!d.isEnd() && d.comment().spec().block()) {
				return "{\n" + indent(out.toString()) + "}\n";
			}
		}
		return out.toString();
	}

	@Override
	public String visitFor(For node) {
		if (node.targets().size() != 1 || !(node.iterable() instanceof Range range)) {
			throw unsupported(node, "iteration over anything but a range");
		}
		try (ScopeManager.Guard ignored = enter(node)) {
			String index = print(node.targets().get(0));
			String step = range.step() == null ? "1" : print(range.step());
			String compare = isNegative(range.step()) ? " > " : " < ";
			return "for (" + index + " = " + print(range.start()) + "; " + index + compare + print(range.stop())
					+ "; " + index + " += " + step + ")\n" + braced(node.body());
		}
	}

	private static boolean isNegative(Node step) {
		if (step instanceof Literal lit) {
			return lit.value().startsWith("-");
		}
		return step instanceof UnaryOp unary && unary.op() == UnaryOperator.NEG;
	}

	private String braced(CodeBlock body) {
		return "{\n" + indent(print(body)) + "}\n";
	}

	@Override
	public String visitWhile(While node) {
		String condition = print(node.condition());
		try (ScopeManager.Guard ignored = enter(node)) {
			return "while (" + condition + ")\n" + braced(node.body());
		}
	}

	@Override
	public String visitIf(If node) {
		List<IfSection> sections = node.sections();
		StringBuilder out = new StringBuilder();
		for (int i = 0; i < sections.size(); i++) {
			IfSection section = sections.get(i);
			if (i == 0) {
				out.append(print(section));
			} else if (i == sections.size() - 1 && section.condition() instanceof Literal lit && lit.isTrue()) {
				out.append("else\n").append(braced(section.body()));
			} else {
				out.append("else ").append(print(section));
			}
		}
		return out.toString();
	}

	@Override
	public String visitIfSection(IfSection node) {
		return "if (" + print(node.condition()) + ")\n" + braced(node.body());
	}

	@Override
	public String visitReturn(Return node) {
		List<Node> values = node.values();
		if (values.isEmpty()) {
			return "return;\n";
		}
		if (values.size() > 1) {
			throw unsupported(node, "returning several values");
		}
		return "return " + print(values.get(0)) + ";\n";
	}

	@Override
	public String visitBreak(Break node) {
		return "break;\n";
	}

	@Override
	public String visitContinue(Continue node) {
		return "continue;\n";
	}

	@Override
	public String visitPass(Pass node) {
		return "";
	}

	@Override
	public String visitPrint(Print node) {
		imports.include("<stdio.h>");
		List<String> formats = new ArrayList<>();
		List<String> values = new ArrayList<>();
		for (Node arg : node.args()) {
			TypeDescriptor type = typeOf(arg);
			if (type == null || type.rank() > 0) {
				throw unsupported(arg, "printing " + arg.kind());
			}
			String value = print(arg);
			switch (type.kind()) {
				case BOOL:
					formats.add("%s");
					values.add("(" + value + ") ? \"True\" : \"False\"");
					break;
				case INTEGER:
					formats.add("%lld");
					values.add("(long long)(" + value + ")");
					break;
				case FLOAT:
					formats.add("%.12lf");
					values.add(value);
					break;
				case COMPLEX:
					imports.include("<complex.h>");
					formats.add("(%.12lf+%.12lfj)");
					values.add("creal(" + value + ")");
					values.add("cimag(" + value + ")");
					break;
				default:
					formats.add("%s");
					values.add(value);
					break;
			}
		}
		StringBuilder out = new StringBuilder("printf(\"").append(String.join(" ", formats)).append("\\n\"");
		for (String v : values) {
			out.append(", ").append(v);
		}
		return out.append(");\n").toString();
	}

	@Override
	public String visitComment(Comment node) {
		return "/* " + node.text() + " */\n";
	}

	@Override
	public String visitCommentBlock(CommentBlock node) {
		return "/*\n" + String.join("\n", node.lines()) + "\n*/\n";
	}

	@Override
	public String visitDel(Del node) {
		StringBuilder out = new StringBuilder();
		for (Variable v : node.variables()) {
			if (v.type().rank() > 0) {
				imports.include(NDARRAYS);
				out.append("free_array(").append(name(v)).append(");\n");
			}
		}
		return out.toString();
	}

	@Override
	public String visitKernelCall(KernelCall node) {
		return node.name() + "<<<" + print(node.blocks()) + ", " + print(node.threads()) + ">>>("
				+ join(", ", node.args()) + ");\n";
	}

	/** End directives are implied by the closing brace of the block they annotate. */
	@Override
	public String visitDirective(Directive node) {
		if (node.isEnd()) {
			return "";
		}
		return "#pragma omp " + node.comment().clauseText() + "\n";
	}

	// ---------------------------------------------------------------- definitions

	@Override
	public String visitFunctionDef(FunctionDef node) {
		if (node.results().size() > 1) {
			throw unsupported(node, "returning several values");
		}
		StringBuilder out = new StringBuilder();
		out.append(joinAll(node.imports()));
		out.append(joinAll(node.interfaces()));
		out.append(joinAll(uncovered(node.functions(), node.interfaces())));
		if (node.docstring() != null) {
			out.append(print(node.docstring()));
		}
		try (ScopeManager.Guard ignored = enter(node)) {
			out.append(signature(node)).append('\n');
			List<Variable> locals = new ArrayList<>(node.results());
			for (Variable v : node.locals()) {
				if (!locals.contains(v)) {
					locals.add(v);
				}
			}
			String declared = declarations(locals);
			String body = print(node.body());
			String inner = declared.isEmpty() || body.isEmpty() ? declared + body : declared + "\n" + body;
			out.append("{\n").append(indent(inner)).append("}\n\n");
		}
		return out.toString();
	}

	private String signature(FunctionDef node) {
		StringBuilder sb = new StringBuilder();
		for (Decorator d : node.decorators()) {
			if (d.kind() == DecoratorKind.KERNEL) {
				sb.append("__global__ ");
			} else if (d.kind() == DecoratorKind.DEVICE) {
				sb.append("__device__ ");
			}
		}
		List<Variable> results = node.results();
		sb.append(results.isEmpty() ? "void" : cType(results.get(0).type(), results.get(0)));
		sb.append(' ').append(node.name()).append('(');
		sb.append(node.arguments().isEmpty() ? "void" : join(", ", node.arguments()));
		return sb.append(')').toString();
	}

	@Override
	public String visitFunctionArgument(FunctionArgument node) {
		if (node.hasDefault()) {
			throw unsupported(node, "default argument value");
		}
		Variable v = node.variable();
		return cType(v.type(), v) + " " + name(v);
	}

	@Override
	public String visitInterface(Interface node) {
		return joinAll(node.functions());
	}

	@Override
	public String visitClassDef(ClassDef node) {
		throw unsupported(node, "class definition");
	}

	/** Imports become includes; Python-only modules have no C counterpart. */
	@Override
	public String visitImport(Import node) {
		String source = node.source();
		imports.recordModule(source);
		if (IGNORED_SOURCES.contains(source)) {
			return "";
		}
		if (source.equals("omp_lib")) {
			imports.include("<omp.h>");
		} else {
			imports.include("\"" + source + ".h\"");
		}
		return "";
	}

	@Override
	public String visitModule(Module node) {
		try (ScopeManager.Guard ignored = enter(node)) {
			joinAll(node.imports());
			if (!node.classes().isEmpty()) {
				throw unsupported(node.classes().get(0), "class definition");
			}
			StringBuilder body = new StringBuilder();
			String globals = declarations(node.variables());
			if (!globals.isEmpty()) {
				body.append(globals).append('\n');
			}
			body.append(joinAll(node.interfaces()));
			body.append(joinAll(uncovered(node.functions(), node.interfaces())));
			if (!node.initBody().isEmpty()) {
				body.append("void ").append(node.name()).append("__init(void)\n")
						.append(braced(node.initBody())).append('\n');
			}
			if (node.program() != null) {
				body.append(print(node.program()));
			}
			return includes() + "\n" + body;
		}
	}

	private String includes() {
		StringBuilder out = new StringBuilder();
		for (ImportEntry e : imports.synthesized()) {
			if (e.name() == null) {
				out.append("#include ").append(e.source()).append('\n');
			}
		}
		return out.toString();
	}

	@Override
	public String visitProgram(Program node) {
		try (ScopeManager.Guard ignored = enter(node)) {
			joinAll(node.imports());
			String declared = declarations(node.variables());
			String body = print(node.body());
			String inner = (declared.isEmpty() ? "" : declared + "\n") + body + "return 0;\n";
			return "int main()\n{\n" + indent(inner) + "}\n";
		}
	}
}
