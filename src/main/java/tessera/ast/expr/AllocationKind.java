package tessera.ast.expr;

public enum AllocationKind {
	EMPTY("empty"),
	ZEROS("zeros"),
	ONES("ones"),
	FULL("full");

	private final String canonicalName;

	AllocationKind(String canonicalName) {
		this.canonicalName = canonicalName;
	}

	public String canonicalName() {
		return canonicalName;
	}
}
