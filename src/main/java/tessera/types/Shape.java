package tessera.types;

import tessera.ast.Node;

import java.util.List;

/**
 * Ordered dimension expressions of a value, or unknown.
 */
public record Shape(List<Node> dimensions, boolean known) {
	public static final Shape UNKNOWN = new Shape(List.of(), false);
	public static final Shape SCALAR = new Shape(List.of(), true);

	public Shape {
		dimensions = List.copyOf(dimensions);
	}

	public static Shape of(List<? extends Node> dimensions) {
		return new Shape(List.copyOf(dimensions), true);
	}
}
