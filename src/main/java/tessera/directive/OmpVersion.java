package tessera.directive;

/**
 * Supported revisions of the OpenMP standard. Fixed once per compilation unit.
 */
public enum OmpVersion {
	V4_5("4.5"),
	V5_0("5.0"),
	V5_1("5.1");

	private final String label;

	OmpVersion(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}

	public boolean isAtLeast(OmpVersion other) {
		return compareTo(other) >= 0;
	}

	public static OmpVersion of(String label) {
		for (OmpVersion v : values()) {
			if (v.label.equals(label)) {
				return v;
			}
		}
		throw new IllegalArgumentException("unsupported OpenMP version: " + label);
	}

	@Override
	public String toString() {
		return label;
	}
}
