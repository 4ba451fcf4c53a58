package tessera.ast;

/**
 * A framework invariant was broken (substitution on a missing slot, unbalanced
 * scope exit, ...). Never recovered from.
 */
public class StructuralViolationException extends RuntimeException {
	private final SourceSpan span;

	public StructuralViolationException(String message) {
		this(message, SourceSpan.NONE);
	}

	public StructuralViolationException(String message, SourceSpan span) {
		super(message);
		this.span = span;
	}

	public SourceSpan span() {
		return span;
	}
}
