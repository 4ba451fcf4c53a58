package tessera.print;

import tessera.ast.Node;
import tessera.ast.NodeGraph;
import tessera.ast.decl.ClassDef;
import tessera.ast.decl.Decorator;
import tessera.ast.decl.FunctionArgument;
import tessera.ast.decl.FunctionDef;
import tessera.ast.decl.Import;
import tessera.ast.decl.ImportTarget;
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
import tessera.ast.expr.CombinationMode;
import tessera.ast.expr.Comprehension;
import tessera.ast.expr.FunctionCall;
import tessera.ast.expr.IndexedElement;
import tessera.ast.expr.LibraryCall;
import tessera.ast.expr.ListLiteral;
import tessera.ast.expr.Literal;
import tessera.ast.expr.Nil;
import tessera.ast.expr.Parenthesis;
import tessera.ast.expr.Range;
import tessera.ast.expr.Slice;
import tessera.ast.expr.Symbol;
import tessera.ast.expr.TernaryOp;
import tessera.ast.expr.TupleLiteral;
import tessera.ast.expr.UnaryOp;
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
import tessera.transform.LoweredComprehension;
import tessera.types.ElementKind;
import tessera.types.MemoryOrder;
import tessera.types.Precision;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prints the tree back as Python, importing numpy names as needed.
 */
public final class PythonPrinter extends CodePrinter {
	static final String DECORATORS_MODULE = "tessera.decorators";

	private final CastTable casts = CastTable.python();
	// result variables of nested comprehensions, printed as the comprehension itself
	private final Map<Node, Comprehension> inlined = new IdentityHashMap<>();

	public PythonPrinter(NodeGraph graph, Diagnostics diagnostics, int indentWidth) {
		super(graph, diagnostics, indentWidth);
	}

	@Override
	public Target target() {
		return Target.PYTHON;
	}

	@Override
	protected NameSwaps nameSwaps() {
		return NameSwaps.python();
	}

	// ---------------------------------------------------------------- expressions

	@Override
	public String visitVariable(Variable node) {
		Comprehension nested = inlined.get(node);
		if (nested != null) {
			return print(nested);
		}
		return name(node);
	}

	@Override
	public String visitLiteral(Literal node) {
		String value = pythonValue(node);
		TypeDescriptor type = node.type();
		ElementKind kind = type.kind();
		if (type.precision().isDefault() || kind == ElementKind.BOOL || kind == ElementKind.STRING) {
			return value;
		}
		return constructor(node, kind, type.precision()) + "(" + value + ")";
	}

	private static String pythonValue(Literal node) {
		switch (node.type().kind()) {
			case BOOL:
				return node.isTrue() ? "True" : "False";
			case STRING:
				return "'" + node.value().replace("\\", "\\\\").replace("'", "\\'") + "'";
			case COMPLEX:
				String imag = node.imaginary();
				String sign = imag.startsWith("-") ? "" : "+";
				return "(" + node.value() + sign + imag + "j)";
			default:
				return node.value();
		}
	}

	/** Name of the cast function for the kind and precision, importing it if needed. */
	private String constructor(Node node, ElementKind kind, Precision precision) {
		CastTable.Entry entry = casts.lookup(kind, precision);
		if (entry == null) {
			throw unsupported(node, kind.name().toLowerCase() + " of precision " + precision);
		}
		if (entry.module() == null) {
			return entry.name();
		}
		return imports.register(entry.module(), entry.name());
	}

	@Override
	public String visitSymbol(Symbol node) {
		return node.name();
	}

	@Override
	public String visitBinaryOp(BinaryOp node) {
		return join(" " + node.op().python() + " ", node.args());
	}

	@Override
	public String visitUnaryOp(UnaryOp node) {
		return node.op().python() + print(node.arg());
	}

	@Override
	public String visitParenthesis(Parenthesis node) {
		return "(" + print(node.arg()) + ")";
	}

	@Override
	public String visitTernaryOp(TernaryOp node) {
		return print(node.ifTrue()) + " if " + print(node.condition()) + " else " + print(node.ifFalse());
	}

	@Override
	public String visitCast(Cast node) {
		Node arg = node.arg();
		TypeDescriptor to = node.type();
		if (!((TypedValue) arg).requiresCast(to.kind(), to.precision())) {
			return print(arg);
		}
		if (to.rank() > 0) {
			String astype = imports.register("numpy", "array");
			return astype + "(" + print(arg) + ", dtype=" + constructor(node, to.kind(), to.precision()) + ")";
		}
		return constructor(node, to.kind(), to.precision()) + "(" + print(arg) + ")";
	}

	@Override
	public String visitIndexedElement(IndexedElement node) {
		return print(node.base()) + "[" + join(",", node.indices()) + "]";
	}

	@Override
	public String visitSlice(Slice node) {
		String start = node.start() == null ? "" : print(node.start());
		String stop = node.stop() == null ? "" : print(node.stop());
		String out = start + ":" + stop;
		if (node.step() != null) {
			out += ":" + print(node.step());
		}
		return out;
	}

	@Override
	public String visitAttributeAccess(AttributeAccess node) {
		return print(node.owner()) + "." + node.name();
	}

	@Override
	public String visitFunctionCall(FunctionCall node) {
		String call = node.name() + "(" + join(", ", node.args()) + ")";
		if (node.receiver() != null) {
			return print(node.receiver()) + "." + call;
		}
		return call;
	}

	@Override
	public String visitCallArgument(CallArgument node) {
		if (node.keyword() == null) {
			return print(node.value());
		}
		return node.keyword() + "=" + print(node.value());
	}

	@Override
	public String visitLibraryCall(LibraryCall node) {
		String name = node.function().isBuiltin()
				? node.function().canonicalName()
				: imports.register(node.function().module(), node.function().canonicalName());
		return name + "(" + join(", ", node.args()) + ")";
	}

	@Override
	public String visitArraySize(ArraySize node) {
		return imports.register("numpy", "size") + "(" + print(node.array()) + ")";
	}

	@Override
	public String visitArrayShapeElement(ArrayShapeElement node) {
		return imports.register("numpy", "shape") + "(" + print(node.array()) + ")[" + print(node.index()) + "]";
	}

	@Override
	public String visitArrayAllocation(ArrayAllocation node) {
		String name = imports.register("numpy", node.allocation().canonicalName());
		List<String> args = new ArrayList<>();
		List<Node> shape = node.shape();
		args.add(shape.size() == 1 ? print(shape.get(0)) : "(" + join(", ", shape) + ")");
		if (node.fill() != null) {
			args.add(print(node.fill()));
		}
		TypeDescriptor type = node.type();
		args.add("dtype=" + constructor(node, type.kind(), type.precision()));
		if (type.rank() > 1 && type.order() != MemoryOrder.NONE) {
			args.add("order='" + type.order().flag() + "'");
		}
		return name + "(" + String.join(", ", args) + ")";
	}

	@Override
	public String visitRange(Range node) {
		String out = "range(" + print(node.start()) + ", " + print(node.stop());
		if (node.step() != null) {
			out += ", " + print(node.step());
		}
		return out + ")";
	}

	@Override
	public String visitTupleLiteral(TupleLiteral node) {
		List<Node> elements = node.elements();
		String inner = join(", ", elements);
		return elements.size() == 1 ? "(" + inner + ",)" : "(" + inner + ")";
	}

	@Override
	public String visitListLiteral(ListLiteral node) {
		return "[" + join(", ", node.elements()) + "]";
	}

	@Override
	public String visitNil(Nil node) {
		return "None";
	}

	/**
	 * Collecting comprehensions become {@code array([...])}, mapping ones a plain
	 * list comprehension, and reductions a generator passed to the reducer,
	 * written inline when nested in another comprehension.
	 */
	@Override
	public String visitComprehension(Comprehension node) {
		LoweredComprehension lowered = lower(node);
		List<LoweredComprehension.ForClause> clauses = clauses(node, lowered);
		inlined.putAll(lowered.inlined());
		String element;
		try {
			element = print(lowered.element());
		} finally {
			for (Node result : lowered.inlined().keySet()) {
				inlined.remove(result);
			}
		}
		StringBuilder loops = new StringBuilder();
		for (LoweredComprehension.ForClause c : clauses) {
			loops.append(" for ").append(print(c.index())).append(" in ").append(print(c.iterable()));
		}
		// by name: inside an enclosing comprehension the result variable stands for this node
		String lhs = name(node.lhs());
		CombinationMode mode = node.mode();
		if (mode == CombinationMode.COLLECT) {
			String array = imports.register("numpy", "array");
			return lhs + " = " + array + "([" + element + loops + "])\n";
		}
		if (mode == CombinationMode.MAP) {
			return lhs + " = [" + element + loops + "]\n";
		}
		String generator = mode.reducer() + "(" + element + loops + ")";
		if (!graph.userNodes(node, Comprehension.class).isEmpty()) {
			return generator;
		}
		return lhs + " = " + generator + "\n";
	}

	// ---------------------------------------------------------------- statements

	@Override
	public String visitAssign(Assign node) {
		checkAssignable(node.lhs(), node.rhs());
		return node.lhs() instanceof Variable lhs ? assignment(lhs, node.rhs())
				: print(node.lhs()) + " = " + print(node.rhs()) + "\n";
	}

	@Override
	public String visitAliasAssign(AliasAssign node) {
		return assignment(node.lhs(), node.rhs());
	}

	/** Assigning between arrays of different memory order transposes. */
	private String assignment(Variable lhs, Node rhs) {
		String code = print(lhs) + " = " + print(rhs);
		if (rhs instanceof Variable source && source.type().rank() > 1
				&& source.type().order() != lhs.type().order()) {
			code += ".T";
		}
		return code + "\n";
	}

	@Override
	public String visitAugAssign(AugAssign node) {
		checkAssignable(node.lhs(), node.rhs());
		return print(node.lhs()) + " " + node.op().python() + "= " + print(node.rhs()) + "\n";
	}

	@Override
	public String visitCodeBlock(CodeBlock node) {
		if (node.isEmpty()) {
			return "pass\n";
		}
		StringBuilder out = new StringBuilder();
		for (Node stmt : node.body()) {
			String line = print(stmt);
			out.append(line);
			if (!line.isEmpty() && !line.endsWith("\n")) {
				out.append('\n');
			}
		}
		return out.toString();
	}

	@Override
	public String visitFor(For node) {
		String iterable = print(node.iterable());
		try (ScopeManager.Guard ignored = enter(node)) {
			String targets = join(",", node.targets());
			return "for " + targets + " in " + iterable + ":\n" + indent(print(node.body()));
		}
	}

	@Override
	public String visitWhile(While node) {
		String condition = print(node.condition());
		try (ScopeManager.Guard ignored = enter(node)) {
			return "while " + condition + ":\n" + indent(print(node.body()));
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
				out.append("else:\n").append(indent(print(section.body())));
			} else {
				out.append("el").append(print(section));
			}
		}
		return out.toString();
	}

	@Override
	public String visitIfSection(IfSection node) {
		return "if " + print(node.condition()) + ":\n" + indent(print(node.body()));
	}

	@Override
	public String visitReturn(Return node) {
		if (node.values().isEmpty()) {
			return "return\n";
		}
		return "return " + join(", ", node.values()) + "\n";
	}

	@Override
	public String visitBreak(Break node) {
		return "break\n";
	}

	@Override
	public String visitContinue(Continue node) {
		return "continue\n";
	}

	@Override
	public String visitPass(Pass node) {
		return "pass\n";
	}

	@Override
	public String visitPrint(Print node) {
		return "print(" + join(", ", node.args()) + ")\n";
	}

	@Override
	public String visitComment(Comment node) {
		return "# " + node.text() + "\n";
	}

	@Override
	public String visitCommentBlock(CommentBlock node) {
		return "\"\"\"" + String.join("\n", node.lines()) + "\"\"\"\n";
	}

	@Override
	public String visitDel(Del node) {
		StringBuilder out = new StringBuilder();
		for (Variable v : node.variables()) {
			out.append("del ").append(print(v)).append('\n');
		}
		return out.toString();
	}

	@Override
	public String visitKernelCall(KernelCall node) {
		return node.name() + "[" + print(node.blocks()) + ", " + print(node.threads()) + "]("
				+ join(", ", node.args()) + ")\n";
	}

	@Override
	public String visitDirective(Directive node) {
		return "#$ omp " + node.comment().clauseText() + "\n";
	}

	// ---------------------------------------------------------------- definitions

	@Override
	public String visitFunctionDef(FunctionDef node) {
		return function(node, node.name());
	}

	/**
	 * Docstring, nested imports, nested functions not covered by an interface,
	 * interfaces, then the body; decorators in front, most recent first.
	 */
	private String function(FunctionDef node, String name) {
		StringBuilder body = new StringBuilder();
		String args;
		try (ScopeManager.Guard ignored = enter(node)) {
			args = join(", ", node.arguments());
			if (node.docstring() != null) {
				body.append(indent(print(node.docstring())));
			}
			body.append(indent(joinAll(node.imports())));
			body.append(indent(joinAll(uncovered(node.functions(), node.interfaces()))));
			body.append(indent(joinAll(node.interfaces())));
			body.append(indent(print(node.body())));
		}
		StringBuilder code = new StringBuilder();
		for (Decorator d : node.decorators()) {
			code.append(decorator(d));
		}
		code.append("def ").append(name).append('(').append(args).append("):\n").append(body).append('\n');
		return code.toString();
	}

	private String decorator(Decorator d) {
		switch (d.kind()) {
			case KERNEL:
			case DEVICE:
				return "@" + imports.register(DECORATORS_MODULE, d.name()) + "\n";
			case TYPES:
				if (d.arguments().isEmpty()) {
					return "";
				}
				return "@" + imports.register(DECORATORS_MODULE, "types") + "(" + quoted(d.arguments()) + ")\n";
			case TEMPLATE:
				return "@" + imports.register(DECORATORS_MODULE, "template") + "(name='" + d.name() + "', types=["
						+ quoted(d.arguments()) + "])\n";
			default:
				if (d.arguments().isEmpty()) {
					return "@" + d.name() + "\n";
				}
				return "@" + d.name() + "(" + String.join(", ", d.arguments()) + ")\n";
		}
	}

	private static String quoted(List<String> values) {
		List<String> out = new ArrayList<>(values.size());
		for (String v : values) {
			out.add("'" + v + "'");
		}
		return String.join(", ", out);
	}

	@Override
	public String visitFunctionArgument(FunctionArgument node) {
		StringBuilder out = new StringBuilder(print(node.variable()));
		if (node.annotation() != null) {
			out.append(": ").append(node.annotation());
		}
		if (node.hasDefault()) {
			out.append(node.annotation() != null ? " = " : "=").append(print(node.defaultValue()));
		}
		return out.toString();
	}

	/** One definition carries every signature through its decorators. */
	@Override
	public String visitInterface(Interface node) {
		List<FunctionDef> functions = node.functions();
		if (functions.isEmpty()) {
			return "";
		}
		return function(functions.get(0), node.name());
	}

	@Override
	public String visitClassDef(ClassDef node) {
		String header = node.superclasses().isEmpty()
				? "class " + node.name() + ":\n"
				: "class " + node.name() + "(" + String.join(", ", node.superclasses()) + "):\n";
		try (ScopeManager.Guard ignored = enter(node)) {
			String methods = joinAll(node.methods()) + joinAll(node.interfaces());
			if (methods.isEmpty()) {
				methods = "pass\n";
			}
			return header + indent(methods) + "\n";
		}
	}

	@Override
	public String visitImport(Import node) {
		String source = imports.swaps().source(node.source());
		if (node.targets().isEmpty()) {
			imports.recordModule(node.source());
			return "import " + source + "\n";
		}
		List<String> names = new ArrayList<>();
		for (ImportTarget t : node.targets()) {
			String external = imports.recordExisting(node.source(), t);
			String local = t.alias() == null ? t.name() : t.alias();
			names.add(external.equals(local) ? external : external + " as " + local);
		}
		return "from " + source + " import " + String.join(", ", names) + "\n";
	}

	/**
	 * Imports (written, then synthesized) followed by a blank line, interfaces,
	 * functions not covered by an interface, classes, the initialisation body
	 * and the program block.
	 */
	@Override
	public String visitModule(Module node) {
		try (ScopeManager.Guard ignored = enter(node)) {
			String written = joinAll(node.imports());
			StringBuilder body = new StringBuilder();
			body.append(joinAll(node.interfaces()));
			body.append(joinAll(uncovered(node.functions(), node.interfaces())));
			body.append(joinAll(node.classes()));
			if (!node.initBody().isEmpty()) {
				body.append(print(node.initBody()));
			}
			String program = node.program() == null ? "" : print(node.program());
			String header = written + synthesizedImports();
			return (header.isEmpty() ? "" : header + "\n") + body + program;
		}
	}

	private String synthesizedImports() {
		StringBuilder out = new StringBuilder();
		for (ImportEntry e : imports.synthesized()) {
			if (e.name() == null) {
				out.append("import ").append(e.source()).append('\n');
			} else if (e.alias() == null) {
				out.append("from ").append(e.source()).append(" import ").append(e.name()).append('\n');
			} else {
				out.append("from ").append(e.source()).append(" import ").append(e.name()).append(" as ")
						.append(e.alias()).append('\n');
			}
		}
		return out.toString();
	}

	@Override
	public String visitProgram(Program node) {
		try (ScopeManager.Guard ignored = enter(node)) {
			String body = joinAll(node.imports()) + print(node.body());
			return "if __name__ == \"__main__\":\n" + indent(body) + "\n";
		}
	}
}
