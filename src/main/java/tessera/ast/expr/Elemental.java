package tessera.ast.expr;

/**
 * Implemented by call-like nodes. An elemental call applies independently to
 * each element of an array argument.
 */
public interface Elemental {
	boolean isElemental();
}
