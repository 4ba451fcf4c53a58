package tessera.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Base class of every AST node.
 *
 * A node owns an ordered set of named child slots; each slot holds zero, one or
 * many children. Slots are declared once in the constructor and only the
 * owning {@link NodeGraph} may rebind them afterwards. Reverse (user) edges are
 * not stored here: they live in the graph's index.
 *
 * Identity is object identity. Subclasses must not override equals/hashCode.
 */
public abstract class Node {
	private final SourceSpan span;
	private final Map<String, List<Node>> slots = new LinkedHashMap<>();
	private int id = -1;
	private Stage stage;

	protected Node(SourceSpan span) {
		this.span = span == null ? SourceSpan.NONE : span;
	}

	public abstract <R> R accept(NodeVisitor<R> visitor);

	/** Hook run when the node is added to a graph; throws on an invalid construction. */
	protected void validate(Stage stage) {
	}

	protected final void own(String slot, Node child) {
		declareSlot(slot);
		if (child != null) {
			slots.get(slot).add(child);
		}
	}

	protected final void ownAll(String slot, List<? extends Node> children) {
		declareSlot(slot);
		if (children != null) {
			for (Node child : children) {
				if (child == null) {
					throw new IllegalArgumentException("null child in slot '" + slot + "' of " + kind());
				}
				slots.get(slot).add(child);
			}
		}
	}

	private void declareSlot(String slot) {
		if (slots.containsKey(slot)) {
			throw new IllegalStateException("slot '" + slot + "' declared twice on " + kind());
		}
		slots.put(slot, new ArrayList<>());
	}

	protected final <T> T child(String slot, Class<T> type) {
		List<Node> held = slotContents(slot);
		if (held.isEmpty()) {
			return null;
		}
		return type.cast(held.get(0));
	}

	protected final <T> List<T> children(String slot, Class<T> type) {
		List<Node> held = slotContents(slot);
		List<T> out = new ArrayList<>(held.size());
		for (Node n : held) {
			out.add(type.cast(n));
		}
		return Collections.unmodifiableList(out);
	}

	private List<Node> slotContents(String slot) {
		List<Node> held = slots.get(slot);
		if (held == null) {
			throw new StructuralViolationException("no slot '" + slot + "' on " + kind(), span);
		}
		return held;
	}

	public final Set<String> slotNames() {
		return Collections.unmodifiableSet(slots.keySet());
	}

	/** Every owned child in slot order, duplicates included. */
	public final List<Node> ownedChildren() {
		List<Node> out = new ArrayList<>();
		for (List<Node> held : slots.values()) {
			out.addAll(held);
		}
		return out;
	}

	/** Rebinds every slot entry referencing {@code old}; returns how many entries changed. */
	final int rebind(Node old, Node replacement) {
		int count = 0;
		for (List<Node> held : slots.values()) {
			for (int i = 0; i < held.size(); i++) {
				if (held.get(i) == old) {
					held.set(i, replacement);
					count++;
				}
			}
		}
		return count;
	}

	final void register(int id, Stage stage) {
		this.id = id;
		this.stage = stage;
	}

	public final int id() {
		return id;
	}

	public final boolean isRegistered() {
		return id >= 0;
	}

	public final Stage stage() {
		return stage;
	}

	public final SourceSpan span() {
		return span;
	}

	public String kind() {
		return getClass().getSimpleName();
	}

	@Override
	public String toString() {
		return kind() + "#" + id;
	}
}
