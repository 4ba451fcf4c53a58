package tessera.ast;

import org.apache.log4j.Logger;
import tessera.ast.stmt.Directive;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Owner of one compilation unit's nodes.
 *
 * Keeps the reverse index (child -> users) synchronously up to date with every
 * {@link #add} and {@link #substitute}; user lookup is a single map access.
 * Directives are held as side annotations and never appear in owned slots.
 */
public final class NodeGraph {
	private static final Logger LOG = Logger.getLogger(NodeGraph.class);

	private final Stage stage;
	// child -> (user -> number of slot entries of user referencing child)
	private final Map<Node, Map<Node, Integer>> users = new IdentityHashMap<>();
	private final Map<Node, List<Directive>> annotations = new IdentityHashMap<>();
	private final Map<Directive, Node> annotated = new IdentityHashMap<>();
	private int nextId;

	public NodeGraph(Stage stage) {
		this.stage = stage;
	}

	public Stage stage() {
		return stage;
	}

	/**
	 * Registers a node and any of its owned descendants not yet registered, then
	 * indexes its children. Adding an already registered node is a no-op.
	 */
	public <T extends Node> T add(T node) {
		if (node.isRegistered()) {
			if (!users.containsKey(node)) {
				throw new StructuralViolationException(node + " belongs to another graph", node.span());
			}
			return node;
		}
		for (Node child : node.ownedChildren()) {
			add(child);
		}
		node.validate(stage);
		node.register(nextId++, stage);
		users.put(node, new LinkedHashMap<>());
		for (Node child : node.ownedChildren()) {
			link(child, node, 1);
		}
		return node;
	}

	public boolean contains(Node node) {
		return users.containsKey(node);
	}

	public int size() {
		return users.size();
	}

	/** Nodes whose owned slots currently reference {@code node}. */
	public Set<Node> users(Node node) {
		Set<Node> out = Collections.newSetFromMap(new IdentityHashMap<>());
		out.addAll(requireRegistered(node).keySet());
		return Collections.unmodifiableSet(out);
	}

	/**
	 * Transitive search upwards through user edges for nodes of the given type.
	 * A path stops at the first match.
	 */
	public <T> List<T> userNodes(Node node, Class<T> type) {
		requireRegistered(node);
		List<T> found = new ArrayList<>();
		Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		Deque<Node> work = new ArrayDeque<>(users.get(node).keySet());
		while (!work.isEmpty()) {
			Node user = work.pop();
			if (!seen.add(user)) {
				continue;
			}
			if (type.isInstance(user)) {
				found.add(type.cast(user));
				continue;
			}
			work.addAll(users.get(user).keySet());
		}
		return found;
	}

	/**
	 * Replaces the slot entries of {@code owner} referencing {@code oldChild}.
	 *
	 * @throws StructuralViolationException if {@code owner} has no such slot entry
	 */
	public void substitute(Node owner, Node oldChild, Node newChild) {
		requireRegistered(owner);
		add(newChild);
		int count = owner.rebind(oldChild, newChild);
		if (count == 0) {
			throw new StructuralViolationException(
					"substitute: " + owner + " has no slot referencing " + oldChild, owner.span());
		}
		link(oldChild, owner, -count);
		link(newChild, owner, count);
	}

	/**
	 * Replaces every reference to {@code oldChild} inside the subtree rooted at
	 * {@code root}, without descending into {@code newChild}. Returns the number
	 * of owners rebound; zero is not an error.
	 */
	public int substituteAll(Node root, Node oldChild, Node newChild) {
		requireRegistered(root);
		add(newChild);
		List<Node> owners = new ArrayList<>();
		collectOwners(root, oldChild, newChild, owners, Collections.newSetFromMap(new IdentityHashMap<>()));
		for (Node owner : owners) {
			substitute(owner, oldChild, newChild);
		}
		return owners.size();
	}

	private void collectOwners(Node node, Node oldChild, Node newChild, List<Node> owners, Set<Node> seen) {
		if (node == newChild || !seen.add(node)) {
			return;
		}
		boolean owns = false;
		for (Node child : node.ownedChildren()) {
			if (child == oldChild) {
				owns = true;
			} else {
				collectOwners(child, oldChild, newChild, owners, seen);
			}
		}
		if (owns) {
			owners.add(node);
		}
	}

	/** Attaches a directive to the node it annotates. */
	public void attach(Directive directive, Node target) {
		requireRegistered(target);
		add(directive);
		if (annotated.containsKey(directive)) {
			throw new StructuralViolationException(directive + " is already attached", directive.span());
		}
		annotations.computeIfAbsent(target, k -> new ArrayList<>()).add(directive);
		annotated.put(directive, target);
		LOG.debug("attached " + directive.comment().clauseText() + " to " + target);
	}

	/** Removes a directive attached with {@link #attach}. */
	public void detach(Directive directive) {
		Node target = annotated.remove(directive);
		if (target == null) {
			throw new StructuralViolationException(directive + " is not attached", directive.span());
		}
		List<Directive> held = annotations.get(target);
		held.remove(directive);
		if (held.isEmpty()) {
			annotations.remove(target);
		}
		LOG.debug("detached " + directive.comment().clauseText() + " from " + target);
	}

	public List<Directive> directives(Node target) {
		List<Directive> held = annotations.get(target);
		return held == null ? List.of() : Collections.unmodifiableList(held);
	}

	public Node annotatedBy(Directive directive) {
		return annotated.get(directive);
	}

	private void link(Node child, Node user, int delta) {
		Map<Node, Integer> held = requireRegistered(child);
		int count = held.getOrDefault(user, 0) + delta;
		if (count < 0) {
			throw new StructuralViolationException("reverse index underflow for " + child, child.span());
		}
		if (count == 0) {
			held.remove(user);
		} else {
			held.put(user, count);
		}
	}

	private Map<Node, Integer> requireRegistered(Node node) {
		Map<Node, Integer> held = users.get(node);
		if (held == null) {
			throw new StructuralViolationException(node + " is not part of this graph", node.span());
		}
		return held;
	}
}
