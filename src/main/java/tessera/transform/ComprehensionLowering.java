package tessera.transform;

import tessera.ast.Node;
import tessera.ast.expr.BinaryOp;
import tessera.ast.expr.CombinationMode;
import tessera.ast.expr.Comprehension;
import tessera.ast.expr.LibraryCall;
import tessera.ast.expr.Operator;
import tessera.ast.expr.Variable;
import tessera.ast.stmt.Assign;
import tessera.ast.stmt.AugAssign;
import tessera.ast.stmt.CodeBlock;
import tessera.ast.stmt.For;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Recovers the element expression and the iterables of a comprehension from
 * the loop nest the semantic stage desugared it into.
 *
 * The walk descends through code blocks, loops and nested comprehensions
 * until it reaches the single assignment computing the element. A block may
 * hold more than that statement only when the extra statements are nested
 * comprehensions, which stand in for their result variable in the statements
 * reading it, or assignments to the comprehension's accumulator. Anything else
 * is rejected.
 *
 * The tree is never modified: the stand-ins are returned with the result, so
 * the same graph can be printed again for another target.
 */
public final class ComprehensionLowering {
	public LoweredComprehension lower(Comprehension comprehension) {
		List<Node> iterables = new ArrayList<>();
		Map<Node, Comprehension> inlined = new IdentityHashMap<>();
		Node terminal = descend(comprehension, iterables, inlined);
		Node element = element(comprehension, terminal);
		return new LoweredComprehension(element, iterables, inlined);
	}

	/** Returns the terminal assignment; appends iterables outer to inner. */
	private Node descend(Comprehension comprehension, List<Node> iterables, Map<Node, Comprehension> inlined) {
		Variable accumulator = comprehension.accumulator();
		Node body = comprehension.loopNest();
		while (!(body instanceof Assign) && !(body instanceof AugAssign)) {
			if (body instanceof CodeBlock block) {
				body = pickStatement(comprehension, block, accumulator, inlined);
			} else if (body instanceof For loop) {
				iterables.add(loop.iterable());
				body = loop.body();
			} else if (body instanceof Comprehension nested) {
				body = descend(nested, iterables, inlined);
			} else {
				throw new LoweringException(body.kind() + " is not handled inside a comprehension",
						comprehension.span());
			}
		}
		return body;
	}

	private Node pickStatement(Comprehension comprehension, CodeBlock block, Variable accumulator,
			Map<Node, Comprehension> inlined) {
		List<Node> stmts = new ArrayList<>(block.body());
		if (stmts.isEmpty()) {
			throw new LoweringException("empty block inside a comprehension", comprehension.span());
		}
		while (stmts.get(0) instanceof Comprehension nested && stmts.size() > 1) {
			stmts.remove(0);
			inlined.put(nested.lhs(), nested);
		}
		for (Node extra : stmts.subList(1, stmts.size())) {
			if (!assignsTo(extra, accumulator)) {
				throw new LoweringException("unexpected " + extra.kind()
						+ " in the loop body of a comprehension; only accumulator updates can be disambiguated",
						comprehension.span());
			}
		}
		return stmts.get(0);
	}

	private static boolean assignsTo(Node stmt, Variable accumulator) {
		if (accumulator == null) {
			return false;
		}
		if (stmt instanceof Assign a) {
			return a.lhs() == accumulator;
		}
		if (stmt instanceof AugAssign a) {
			return a.lhs() == accumulator;
		}
		return false;
	}

	/**
	 * The value combined at each step, with the running result removed from
	 * reductions written as {@code r = r + e} or {@code r = max(r, e)}.
	 */
	private Node element(Comprehension comprehension, Node terminal) {
		if (terminal instanceof AugAssign aug) {
			return aug.rhs();
		}
		Assign assign = (Assign) terminal;
		Node rhs = assign.rhs();
		Node target = assign.lhs();
		CombinationMode mode = comprehension.mode();
		if (mode == CombinationMode.SUM && rhs instanceof BinaryOp op && op.op() == Operator.ADD) {
			return strip(op.args(), target, args -> new BinaryOp(Operator.ADD, args, op.type(), op.span()), rhs);
		}
		if ((mode == CombinationMode.MAX || mode == CombinationMode.MIN) && rhs instanceof LibraryCall call
				&& call.function().canonicalName().equals(mode.reducer())) {
			return strip(call.args(), target,
					args -> new LibraryCall(call.function(), args, call.type(), call.span()), rhs);
		}
		return rhs;
	}

	private Node strip(List<Node> args, Node target, Function<List<Node>, Node> rebuild, Node original) {
		List<Node> rest = new ArrayList<>();
		for (Node a : args) {
			if (!sameTarget(a, target)) {
				rest.add(a);
			}
		}
		if (rest.isEmpty() || rest.size() == args.size()) {
			return original;
		}
		if (rest.size() == 1) {
			return rest.get(0);
		}
		return rebuild.apply(rest);
	}

	private static boolean sameTarget(Node a, Node target) {
		if (a == target) {
			return true;
		}
		return a instanceof Variable va && target instanceof Variable vt && va.name().equals(vt.name());
	}
}
