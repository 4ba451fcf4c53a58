package tessera.ast.expr;

/**
 * Binary operators. The C spelling is null where C needs a library call.
 */
public enum Operator {
	ADD("+", "+"),
	SUB("-", "-"),
	MUL("*", "*"),
	DIV("/", "/"),
	FLOOR_DIV("//", null),
	MOD("%", "%"),
	POW("**", null),
	AND("and", "&&"),
	OR("or", "||"),
	EQ("==", "=="),
	NE("!=", "!="),
	LT("<", "<"),
	LE("<=", "<="),
	GT(">", ">"),
	GE(">=", ">="),
	BIT_AND("&", "&"),
	BIT_OR("|", "|"),
	BIT_XOR("^", "^"),
	LSHIFT("<<", "<<"),
	RSHIFT(">>", ">>"),
	IS("is", "=="),
	IS_NOT("is not", "!=");

	private final String python;
	private final String c;

	Operator(String python, String c) {
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
