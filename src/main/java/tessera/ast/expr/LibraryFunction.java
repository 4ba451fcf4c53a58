package tessera.ast.expr;

/**
 * Catalog entry of a library function. {@code module} is null for builtins.
 * The name is the canonical internal one; printers map it to the target's.
 */
public record LibraryFunction(String module, String canonicalName, boolean elemental) {
	public LibraryFunction {
		if (canonicalName == null || canonicalName.isEmpty()) {
			throw new IllegalArgumentException("library function needs a name");
		}
	}

	public static LibraryFunction builtin(String name, boolean elemental) {
		return new LibraryFunction(null, name, elemental);
	}

	public static LibraryFunction numpy(String name, boolean elemental) {
		return new LibraryFunction("numpy", name, elemental);
	}

	public static LibraryFunction math(String name) {
		return new LibraryFunction("math", name, true);
	}

	public boolean isBuiltin() {
		return module == null;
	}
}
