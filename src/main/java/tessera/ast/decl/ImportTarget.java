package tessera.ast.decl;

/**
 * {@code name as alias}; alias is null when the name is used unchanged. Names
 * are canonical.
 */
public record ImportTarget(String name, String alias) {
	public static ImportTarget of(String name) {
		return new ImportTarget(name, null);
	}

	public String localName() {
		return alias == null ? name : alias;
	}
}
