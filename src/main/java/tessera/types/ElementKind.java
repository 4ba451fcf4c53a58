package tessera.types;

/**
 * Element kinds of the typed subset. Numeric kinds are ordered by promotion:
 * a value of a later numeric kind never converts implicitly to an earlier one.
 */
public enum ElementKind {
	BOOL(8, true),
	INTEGER(64, true),
	FLOAT(64, true),
	COMPLEX(128, true),
	STRING(0, false),
	VOID(0, false);

	private final int defaultBits;
	private final boolean numeric;

	ElementKind(int defaultBits, boolean numeric) {
		this.defaultBits = defaultBits;
		this.numeric = numeric;
	}

	/** Width a backend uses natively when no precision is given. */
	public int defaultBits() {
		return defaultBits;
	}

	public boolean isNumeric() {
		return numeric;
	}

	/** True when a value of this kind can be stored in {@code target} without an explicit cast. */
	public boolean widensTo(ElementKind target) {
		if (this == target) {
			return true;
		}
		return numeric && target.numeric && ordinal() <= target.ordinal();
	}
}
