package tessera.scope;

import tessera.ast.Node;
import tessera.ast.StructuralViolationException;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One lexical scope: declarations made in it and the identifiers emitted for
 * them. Closed once exited; a closed scope cannot be queried.
 */
public final class Scope {
	private final Scope parent;
	private final String label;
	private final Map<String, Node> declarations = new LinkedHashMap<>();
	private final Map<String, String> emitted = new HashMap<>();
	private final Set<String> generated = new HashSet<>();
	private boolean closed;

	Scope(Scope parent, String label) {
		this.parent = parent;
		this.label = label;
	}

	public Scope parent() {
		return parent;
	}

	public String label() {
		return label;
	}

	public boolean isClosed() {
		return closed;
	}

	/** Declaration of {@code name} here or in an enclosing scope, or null. */
	public Node lookup(String name) {
		requireOpen();
		for (Scope s = this; s != null; s = s.parent) {
			Node found = s.declarations.get(name);
			if (found != null) {
				return found;
			}
		}
		return null;
	}

	/** Identifier emitted for {@code name}, searched outwards, or null. */
	public String emittedName(String name) {
		requireOpen();
		for (Scope s = this; s != null; s = s.parent) {
			String found = s.emitted.get(name);
			if (found != null) {
				return found;
			}
		}
		return null;
	}

	/** True if {@code name} is declared or emitted in this scope or any ancestor. */
	boolean isVisible(String name) {
		for (Scope s = this; s != null; s = s.parent) {
			if (s.declarations.containsKey(name) || s.emitted.containsValue(name)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * True if {@code name} cannot be used for a new declaration here: it is
	 * already declared in this scope, or it was generated in a visible scope.
	 */
	boolean isTaken(String name) {
		if (declarations.containsKey(name)) {
			return true;
		}
		for (Scope s = this; s != null; s = s.parent) {
			if (s.generated.contains(name)) {
				return true;
			}
		}
		return false;
	}

	void bind(String name, String emittedName, Node declaration) {
		requireOpen();
		declarations.put(name, declaration);
		emitted.put(name, emittedName);
		if (!name.equals(emittedName)) {
			generated.add(emittedName);
		}
	}

	void generate(String name) {
		requireOpen();
		declarations.put(name, null);
		emitted.put(name, name);
		generated.add(name);
	}

	public Map<String, Node> declarations() {
		return Collections.unmodifiableMap(declarations);
	}

	void close() {
		closed = true;
	}

	private void requireOpen() {
		if (closed) {
			throw new StructuralViolationException("scope '" + label + "' has already been exited");
		}
	}

	@Override
	public String toString() {
		return "Scope(" + label + ")";
	}
}
