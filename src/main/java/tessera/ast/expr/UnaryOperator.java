package tessera.ast.expr;

public enum UnaryOperator {
	POS("+", "+"),
	NEG("-", "-"),
	NOT("not ", "!"),
	INVERT("~", "~");

	private final String python;
	private final String c;

	UnaryOperator(String python, String c) {
		this.python = python;
		this.c = c;
	}

	public String python() {
		return python;
	}

	public String c() {
		return c;
	}
}
