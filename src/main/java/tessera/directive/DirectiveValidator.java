package tessera.directive;

import tessera.ast.Node;
import tessera.ast.NodeGraph;
import tessera.ast.expr.Variable;
import tessera.ast.stmt.CodeBlock;
import tessera.ast.stmt.Directive;
import tessera.ast.stmt.For;
import tessera.diag.Diagnostics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a parsed directive against the node it annotates.
 */
public final class DirectiveValidator {
	private static final Set<String> DATA_SHARING = Set.of(
			"private", "shared", "firstprivate", "lastprivate", "reduction", "copyin", "copyprivate", "linear",
			"aligned", "nontemporal", "is_device_ptr", "use_device_ptr");

	private final NodeGraph graph;
	private final Diagnostics diagnostics;

	public DirectiveValidator(NodeGraph graph, Diagnostics diagnostics) {
		this.graph = graph;
		this.diagnostics = diagnostics;
	}

	public void validate(Directive directive, Node target) {
		DirectiveComment comment = directive.comment();
		if (comment.end()) {
			requireOpenBegin(directive, target);
			return;
		}
		if (comment.spec().loop() && !(target instanceof For)) {
			throw diagnostics.fatal("'" + comment.fullConstruct() + "' must annotate a for loop, not "
					+ target.kind(), directive.span(), comment.clauseText());
		}
		Clause collapse = comment.clause("collapse");
		if (collapse != null) {
			checkCollapse(directive, collapse, target);
		}
		checkDataSharing(directive, target);
	}

	private void requireOpenBegin(Directive directive, Node target) {
		String construct = directive.comment().fullConstruct();
		int open = 0;
		for (Directive d : graph.directives(target)) {
			if (!d.comment().fullConstruct().equals(construct)) {
				continue;
			}
			open += d.isEnd() ? -1 : 1;
		}
		if (open <= 0) {
			throw diagnostics.fatal("end directive without a matching '" + construct + "' on the same construct",
					directive.span(), directive.comment().clauseText());
		}
	}

	private void checkCollapse(Directive directive, Clause collapse, Node target) {
		int wanted;
		try {
			wanted = Integer.parseInt(collapse.arguments().get(0));
		} catch (NumberFormatException e) {
			throw diagnostics.fatal("collapse needs a constant loop count, got '" + collapse.rawArguments() + "'",
					directive.span(), directive.comment().clauseText());
		}
		if (wanted < 1) {
			throw diagnostics.fatal("collapse count must be positive", directive.span(),
					directive.comment().clauseText());
		}
		int depth = perfectNestDepth((For) target);
		if (depth < wanted) {
			throw diagnostics.fatal("collapse(" + wanted + ") needs " + wanted + " perfectly nested loops, found "
					+ depth, directive.span(), directive.comment().clauseText());
		}
	}

	/** Number of loops nested with nothing between them, the outer one included. */
	static int perfectNestDepth(For loop) {
		int depth = 1;
		For current = loop;
		while (true) {
			CodeBlock body = current.body();
			List<Node> stmts = body.body();
			if (stmts.size() != 1 || !(stmts.get(0) instanceof For)) {
				return depth;
			}
			current = (For) stmts.get(0);
			depth++;
		}
	}

	private void checkDataSharing(Directive directive, Node target) {
		Set<String> used = null;
		for (Clause clause : directive.comment().clauses()) {
			if (!DATA_SHARING.contains(clause.name())) {
				continue;
			}
			if (used == null) {
				used = variableNames(target);
			}
			for (String argument : clause.arguments()) {
				String name = baseName(argument);
				if (!name.isEmpty() && !used.contains(name)) {
					diagnostics.error("variable '" + name + "' in " + clause.name()
							+ " clause is not used in the annotated code", directive.span(), argument);
				}
			}
		}
	}

	/** {@code a[0:n]} -> {@code a}, {@code i:2} -> {@code i}. */
	private static String baseName(String argument) {
		int cut = argument.length();
		for (int i = 0; i < argument.length(); i++) {
			char ch = argument.charAt(i);
			if (ch == '[' || ch == ':' || ch == '(') {
				cut = i;
				break;
			}
		}
		return argument.substring(0, cut).trim();
	}

	private static Set<String> variableNames(Node root) {
		Set<String> names = new HashSet<>();
		Deque<Node> work = new ArrayDeque<>();
		work.push(root);
		while (!work.isEmpty()) {
			Node n = work.pop();
			if (n instanceof Variable v) {
				names.add(v.name());
			}
			for (Node child : n.ownedChildren()) {
				work.push(child);
			}
		}
		return names;
	}
}
