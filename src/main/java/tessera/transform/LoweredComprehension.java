package tessera.transform;

import tessera.ast.Node;
import tessera.ast.SourceSpan;
import tessera.ast.expr.Comprehension;
import tessera.ast.expr.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Element expression and iterables recovered from a comprehension's loop nest,
 * outermost iterable first. {@code inlined} maps the result variable of each
 * nested comprehension to the comprehension to print in its place.
 */
public record LoweredComprehension(Node element, List<Node> iterables, Map<Node, Comprehension> inlined) {
	public LoweredComprehension {
		iterables = List.copyOf(iterables);
		inlined = Collections.unmodifiableMap(new IdentityHashMap<>(inlined));
	}

	public LoweredComprehension(Node element, List<Node> iterables) {
		this(element, iterables, Map.of());
	}

	/** The nested comprehension standing in for {@code node}, or the node itself. */
	public Node resolve(Node node) {
		Comprehension nested = inlined.get(node);
		return nested == null ? node : nested;
	}

	/** One clause per loop level. */
	public record ForClause(Variable index, Node iterable) {
	}

	/**
	 * Pairs the iterables with the comprehension's index variables positionally.
	 *
	 * @throws LoweringException if the two lists differ in length
	 */
	public List<ForClause> clauses(List<Variable> indices, SourceSpan span) {
		if (indices.size() != iterables.size()) {
			throw new LoweringException("comprehension has " + indices.size() + " index variables but "
					+ iterables.size() + " loops", span);
		}
		List<ForClause> out = new ArrayList<>(indices.size());
		for (int i = 0; i < indices.size(); i++) {
			out.add(new ForClause(indices.get(i), iterables.get(i)));
		}
		return out;
	}
}
