package tessera.diag;

import tessera.ast.SourceSpan;

/**
 * One reported problem. {@code symbol} is the offending source text, kept
 * verbatim; it may be null.
 */
public record Diagnostic(Severity severity, String message, SourceSpan span, String symbol) {
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(severity.name().toLowerCase()).append(": ");
		if (span != null && span.isKnown()) {
			sb.append(span).append(": ");
		}
		sb.append(message);
		if (symbol != null) {
			sb.append(" (").append(symbol).append(')');
		}
		return sb.toString();
	}
}
