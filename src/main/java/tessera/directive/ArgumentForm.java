package tessera.directive;

/** Whether a clause or construct takes a parenthesised argument. */
public enum ArgumentForm {
	NONE,
	OPTIONAL,
	REQUIRED;

	static ArgumentForm of(String text) {
		if (text == null) {
			return NONE;
		}
		return valueOf(text.toUpperCase());
	}

	public boolean accepts(boolean present) {
		switch (this) {
			case NONE:
				return !present;
			case REQUIRED:
				return present;
			default:
				return true;
		}
	}
}
