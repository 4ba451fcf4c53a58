package tessera.scope;

import tessera.ast.Node;
import tessera.ast.StructuralViolationException;

import java.util.Set;

/**
 * Stack of nested scopes for one walk of a compilation unit.
 *
 * Scopes are entered with {@link #open} and released by closing the returned
 * {@link Guard}, so every path out of a construct exits its scope:
 *
 * <pre>
 * try (ScopeManager.Guard g = scopes.open("f")) {
 *     ...
 * }
 * </pre>
 *
 * Names handed out by {@link #declare} and {@link #freshName} never collide with
 * the reserved words of the target or with a name visible from the current
 * scope.
 */
public final class ScopeManager {
	private final Set<String> reserved;
	private final Scope root;
	private Scope current;
	private int entered;
	private int exited;

	public ScopeManager(Set<String> reserved) {
		this.reserved = Set.copyOf(reserved);
		this.root = new Scope(null, "<root>");
		this.current = root;
	}

	public Scope root() {
		return root;
	}

	public Scope current() {
		return current;
	}

	public Guard open(String label) {
		current = new Scope(current, label);
		entered++;
		return new Guard(current);
	}

	public void exit(Scope scope) {
		if (scope != current) {
			throw new StructuralViolationException("unbalanced scope exit: " + scope + " is not the current " + current);
		}
		if (scope == root) {
			throw new StructuralViolationException("the root scope cannot be exited");
		}
		scope.close();
		current = scope.parent();
		exited++;
	}

	public Node lookup(String name) {
		return current.lookup(name);
	}

	/**
	 * Declares {@code name} in the current scope and returns the identifier to
	 * emit for it: the name itself, or a fresh one when it is reserved, declared
	 * here for another node, or already handed out as a generated name.
	 */
	public String declare(String name, Node declaration) {
		String already = current.emittedName(name);
		if (already != null && current.lookup(name) == declaration) {
			return already;
		}
		String emitted = name;
		if (reserved.contains(name) || current.isTaken(name)) {
			emitted = freshCandidate(name);
		}
		current.bind(name, emitted, declaration);
		return emitted;
	}

	/** Identifier emitted for {@code name}; the name itself when it was never declared. */
	public String emittedName(String name) {
		String found = current.emittedName(name);
		return found == null ? name : found;
	}

	/**
	 * Returns a name not bound in the current scope or any ancestor and not
	 * reserved, and binds it in the current scope.
	 */
	public String freshName(String hint) {
		String name = freshCandidate(hint);
		current.generate(name);
		return name;
	}

	/** Like {@link #freshName}, but bound in the root scope so it stays reserved for the whole unit. */
	public String freshGlobalName(String hint) {
		String name = freshCandidate(hint);
		root.generate(name);
		return name;
	}

	private String freshCandidate(String hint) {
		for (int i = 0; ; i++) {
			String candidate = String.format("%s_%04d", hint, i);
			if (!reserved.contains(candidate) && !current.isVisible(candidate)) {
				return candidate;
			}
		}
	}

	public boolean isReserved(String name) {
		return reserved.contains(name);
	}

	public int enterCount() {
		return entered;
	}

	public int exitCount() {
		return exited;
	}

	/** Number of open scopes below the root. */
	public int depth() {
		int d = 0;
		for (Scope s = current; s != root; s = s.parent()) {
			d++;
		}
		return d;
	}

	/** Exits its scope on close. */
	public final class Guard implements AutoCloseable {
		private final Scope scope;

		private Guard(Scope scope) {
			this.scope = scope;
		}

		public Scope scope() {
			return scope;
		}

		@Override
		public void close() {
			exit(scope);
		}
	}
}
