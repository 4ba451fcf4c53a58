package tessera.print;

import tessera.ast.Node;
import tessera.ast.NodeGraph;
import tessera.ast.NodeVisitor;
import tessera.ast.ScopedNode;
import tessera.ast.decl.FunctionDef;
import tessera.ast.decl.Interface;
import tessera.ast.expr.Cast;
import tessera.ast.expr.Comprehension;
import tessera.ast.expr.Variable;
import tessera.ast.stmt.Directive;
import tessera.diag.CompilationAbortedException;
import tessera.diag.Diagnostics;
import tessera.scope.ScopeManager;
import tessera.transform.ComprehensionLowering;
import tessera.transform.LoweredComprehension;
import tessera.transform.LoweringException;
import tessera.types.ElementKind;
import tessera.types.TypedValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Base of the target printers.
 *
 * Dispatch is by {@link NodeVisitor}: every variant has a visit
 * method, and a backend that cannot render one reports it through
 * {@link #unsupported}. State (scopes, imports) belongs to one compilation
 * unit; use a new printer per unit.
 */
public abstract class CodePrinter implements NodeVisitor<String> {
	protected final NodeGraph graph;
	protected final Diagnostics diagnostics;
	protected final ScopeManager scopes;
	protected final ImportRegistry imports;
	protected final ComprehensionLowering lowering;
	private final String tab;

	protected CodePrinter(NodeGraph graph, Diagnostics diagnostics, int indentWidth) {
		this.graph = graph;
		this.diagnostics = diagnostics;
		this.scopes = new ScopeManager(target().reservedWords());
		this.imports = new ImportRegistry(nameSwaps(), scopes);
		this.lowering = new ComprehensionLowering();
		this.tab = " ".repeat(indentWidth);
	}

	public abstract Target target();

	protected abstract NameSwaps nameSwaps();

	/** Renders a node together with the directives attached to it. */
	public final String print(Node node) {
		String code = node.accept(this);
		List<Directive> directives = graph.directives(node);
		if (directives.isEmpty()) {
			return code;
		}
		StringBuilder before = new StringBuilder();
		StringBuilder after = new StringBuilder();
		for (Directive d : directives) {
			if (d.isEnd()) {
				after.append(d.accept(this));
			} else {
				before.append(d.accept(this));
			}
		}
		return before + code + after;
	}

	public ImportRegistry imports() {
		return imports;
	}

	public ScopeManager scopes() {
		return scopes;
	}

	/**
	 * Indents every non-empty line of an already rendered body by one level.
	 * Leading and trailing newlines are dropped and a single one is put back.
	 */
	protected String indent(String lines) {
		if (lines.isEmpty()) {
			return lines;
		}
		StringBuilder out = new StringBuilder();
		for (String line : stripNewlines(lines).split("\n", -1)) {
			if (!line.isEmpty()) {
				out.append(tab);
			}
			out.append(line).append('\n');
		}
		return out.toString();
	}

	private static String stripNewlines(String s) {
		int start = 0;
		int end = s.length();
		while (start < end && s.charAt(start) == '\n') {
			start++;
		}
		while (end > start && s.charAt(end - 1) == '\n') {
			end--;
		}
		return s.substring(start, end);
	}

	/** Opens the scope of a construct and declares the variables it introduces. */
	protected ScopeManager.Guard enter(ScopedNode construct) {
		ScopeManager.Guard guard = scopes.open(construct.scopeLabel());
		for (Variable v : construct.scopeVariables()) {
			scopes.declare(v.name(), v);
		}
		return guard;
	}

	protected String name(Variable v) {
		return scopes.emittedName(v.name());
	}

	protected LoweredComprehension lower(Comprehension comprehension) {
		try {
			return lowering.lower(comprehension);
		} catch (LoweringException e) {
			throw diagnostics.fatal(e.getMessage(), e.span(), comprehension.kind());
		}
	}

	protected List<LoweredComprehension.ForClause> clauses(Comprehension comprehension, LoweredComprehension lowered) {
		try {
			return lowered.clauses(comprehension.indices(), comprehension.span());
		} catch (LoweringException e) {
			throw diagnostics.fatal(e.getMessage(), e.span(), comprehension.kind());
		}
	}

	protected CompilationAbortedException unsupported(Node node) {
		return unsupported(node, node.kind());
	}

	protected CompilationAbortedException unsupported(Node node, String what) {
		return diagnostics.fatal("restriction: " + what + " is not yet supported for target " + target().label(),
				node.span(), node.kind());
	}

	/**
	 * Rejects an assignment that would lose information without an explicit
	 * {@link Cast}; such casts are inserted before printing, never here.
	 */
	protected void checkAssignable(Node lhs, Node rhs) {
		if (!(lhs instanceof TypedValue target) || !(rhs instanceof TypedValue value) || rhs instanceof Cast) {
			return;
		}
		ElementKind to = target.type().kind();
		ElementKind from = value.type().kind();
		if (to.isNumeric() && from.isNumeric() && !from.widensTo(to)) {
			throw diagnostics.fatal("type mismatch: cannot store " + value.type() + " in " + target.type()
					+ " without an explicit cast", rhs.span(), rhs.kind());
		}
	}

	/** Joins rendered parts with {@code sep}. */
	protected String join(String sep, List<? extends Node> nodes) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < nodes.size(); i++) {
			if (i > 0) {
				sb.append(sep);
			}
			sb.append(print(nodes.get(i)));
		}
		return sb.toString();
	}

	protected String joinAll(List<? extends Node> nodes) {
		StringBuilder out = new StringBuilder();
		for (Node n : nodes) {
			out.append(print(n));
		}
		return out.toString();
	}

	/** Functions not already printed as part of one of the interfaces. */
	protected static List<FunctionDef> uncovered(List<FunctionDef> functions, List<Interface> interfaces) {
		List<FunctionDef> out = new ArrayList<>();
		for (FunctionDef f : functions) {
			boolean covered = false;
			for (Interface i : interfaces) {
				if (i.functions().contains(f)) {
					covered = true;
					break;
				}
			}
			if (!covered) {
				out.add(f);
			}
		}
		return out;
	}
}
