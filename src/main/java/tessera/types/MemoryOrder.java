package tessera.types;

public enum MemoryOrder {
	ROW_MAJOR("C"),
	COLUMN_MAJOR("F"),
	NONE("");

	private final String flag;

	MemoryOrder(String flag) {
		this.flag = flag;
	}

	/** The order letter used by array libraries ({@code C} or {@code F}). */
	public String flag() {
		return flag;
	}
}
