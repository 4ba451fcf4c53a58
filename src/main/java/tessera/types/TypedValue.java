package tessera.types;

/**
 * Any expression carrying a resolved type.
 */
public interface TypedValue {
	TypeDescriptor type();

	default TypeDescriptor describeType() {
		return type();
	}

	default boolean requiresCast(ElementKind targetKind, Precision targetPrecision) {
		return type().requiresCast(targetKind, targetPrecision);
	}
}
