package tessera.ast.expr;

/**
 * A construct that produces a single value and may therefore be printed inline
 * inside a larger expression.
 */
public interface AtomicValue {
	boolean isAtomic();
}
