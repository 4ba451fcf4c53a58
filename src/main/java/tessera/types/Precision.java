package tessera.types;

/**
 * Bit width of a value, or {@link #DEFAULT} for "the backend's native width".
 * A default precision is never printed as an explicit width.
 */
public record Precision(int bits) {
	public static final Precision DEFAULT = new Precision(-1);

	public Precision {
		if (bits != -1 && bits <= 0) {
			throw new IllegalArgumentException("precision must be positive or default: " + bits);
		}
	}

	public static Precision ofBits(int bits) {
		return bits == -1 ? DEFAULT : new Precision(bits);
	}

	public boolean isDefault() {
		return bits == -1;
	}

	/** Concrete width for the given kind. */
	public int resolve(ElementKind kind) {
		return isDefault() ? kind.defaultBits() : bits;
	}

	@Override
	public String toString() {
		return isDefault() ? "default" : Integer.toString(bits);
	}
}
