package tessera.transform;

import tessera.ast.SourceSpan;

/**
 * A comprehension's desugared form has a shape the lowering cannot interpret.
 */
public class LoweringException extends RuntimeException {
	private final SourceSpan span;

	public LoweringException(String message, SourceSpan span) {
		super(message);
		this.span = span;
	}

	public SourceSpan span() {
		return span;
	}
}
