package tessera.ast.expr;

/**
 * How a comprehension combines its elements into the left-hand target.
 */
public enum CombinationMode {
	COLLECT(null),
	SUM("sum"),
	MAX("max"),
	MIN("min"),
	MAP(null);

	private final String reducer;

	CombinationMode(String reducer) {
		this.reducer = reducer;
	}

	/** Builtin name of the reduction, or null when the mode builds a sequence. */
	public String reducer() {
		return reducer;
	}

	public boolean isReduction() {
		return reducer != null;
	}
}
