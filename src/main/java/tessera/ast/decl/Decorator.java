package tessera.ast.decl;

import java.util.List;

/**
 * A marker on a function definition.
 *
 * For {@link DecoratorKind#TYPES} the arguments are the signature's type
 * strings; for {@link DecoratorKind#TEMPLATE} the name is the template name and
 * the arguments its concrete instantiations; for {@link DecoratorKind#OTHER}
 * they are printed verbatim.
 */
public record Decorator(DecoratorKind kind, String name, List<String> arguments) {
	public Decorator {
		arguments = List.copyOf(arguments);
	}

	public static Decorator kernel() {
		return new Decorator(DecoratorKind.KERNEL, "kernel", List.of());
	}

	public static Decorator device() {
		return new Decorator(DecoratorKind.DEVICE, "device", List.of());
	}

	public static Decorator types(String... signature) {
		return new Decorator(DecoratorKind.TYPES, "types", List.of(signature));
	}

	public static Decorator template(String name, String... instantiations) {
		return new Decorator(DecoratorKind.TEMPLATE, name, List.of(instantiations));
	}

	public static Decorator other(String name, String... arguments) {
		return new Decorator(DecoratorKind.OTHER, name, List.of(arguments));
	}
}
