package tessera.parse.directive;

/**
 * A directive comment does not follow the grammar of the active version.
 * Carries the line and the whole comment text verbatim.
 */
public class DirectiveSyntaxException extends IllegalArgumentException {
	private final int line;
	private final String text;

	public DirectiveSyntaxException(String message, int line, String text) {
		super(message);
		this.line = line;
		this.text = text;
	}

	public int line() {
		return line;
	}

	public String text() {
		return text;
	}
}
