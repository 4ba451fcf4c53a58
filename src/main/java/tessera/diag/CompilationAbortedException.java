package tessera.diag;

/**
 * Unwinds the current compilation unit after a fatal diagnostic has been
 * recorded.
 */
public class CompilationAbortedException extends RuntimeException {
	private final Diagnostic diagnostic;

	public CompilationAbortedException(Diagnostic diagnostic) {
		super(diagnostic.toString());
		this.diagnostic = diagnostic;
	}

	public Diagnostic diagnostic() {
		return diagnostic;
	}
}
