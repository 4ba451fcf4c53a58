package tessera.ast;

/**
 * Source span for diagnostics.
 *
 * Lines are 1-based; offsets are 0-based character indices into the original
 * source text. Unknown positions are -1.
 */
public record SourceSpan(int line, int startOffset, int endOffset) {
	public static final SourceSpan NONE = new SourceSpan(-1, -1, -1);

	public static SourceSpan ofLine(int line) {
		return new SourceSpan(line, -1, -1);
	}

	public boolean isKnown() {
		return line >= 0 || startOffset >= 0;
	}

	@Override
	public String toString() {
		if (!isKnown()) {
			return "<unknown>";
		}
		if (startOffset < 0) {
			return "line " + line;
		}
		return "line " + line + " [" + startOffset + ".." + endOffset + "]";
	}
}
