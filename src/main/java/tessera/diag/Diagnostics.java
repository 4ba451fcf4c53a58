package tessera.diag;

import org.apache.log4j.Logger;
import tessera.ast.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Diagnostics of one compilation unit.
 *
 * Not thread safe. Construct a fresh instance per unit instead of resetting a
 * shared one.
 */
public final class Diagnostics {
	private static final Logger LOG = Logger.getLogger(Diagnostics.class);

	private final List<Diagnostic> reported = new ArrayList<>();

	public Diagnostic warning(String message, SourceSpan span, String symbol) {
		return report(Severity.WARNING, message, span, symbol);
	}

	public Diagnostic error(String message, SourceSpan span, String symbol) {
		return report(Severity.ERROR, message, span, symbol);
	}

	/**
	 * Records a fatal diagnostic and returns the exception that aborts the unit:
	 * {@code throw diagnostics.fatal(...)}.
	 */
	public CompilationAbortedException fatal(String message, SourceSpan span, String symbol) {
		return new CompilationAbortedException(report(Severity.FATAL, message, span, symbol));
	}

	private Diagnostic report(Severity severity, String message, SourceSpan span, String symbol) {
		Diagnostic d = new Diagnostic(severity, message, span == null ? SourceSpan.NONE : span, symbol);
		reported.add(d);
		if (severity == Severity.WARNING) {
			LOG.warn(d);
		} else {
			LOG.error(d);
		}
		return d;
	}

	public int count(Severity severity) {
		int n = 0;
		for (Diagnostic d : reported) {
			if (d.severity() == severity) {
				n++;
			}
		}
		return n;
	}

	public int fatalCount() {
		return count(Severity.FATAL);
	}

	public boolean hasFatal() {
		return fatalCount() > 0;
	}

	public List<Diagnostic> all() {
		return Collections.unmodifiableList(reported);
	}
}
