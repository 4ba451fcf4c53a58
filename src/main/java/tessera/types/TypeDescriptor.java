package tessera.types;

/**
 * Resolved type of a value: element kind, precision, rank, shape and memory
 * order. Immutable.
 */
public record TypeDescriptor(ElementKind kind, Precision precision, int rank, Shape shape, MemoryOrder order) {
	public TypeDescriptor {
		if (kind == null || precision == null || shape == null || order == null) {
			throw new IllegalArgumentException("type descriptor components must not be null");
		}
		if (rank < 0) {
			throw new IllegalArgumentException("negative rank: " + rank);
		}
		if (rank == 0 && order != MemoryOrder.NONE) {
			throw new IllegalArgumentException("a scalar has no memory order");
		}
	}

	public static TypeDescriptor scalar(ElementKind kind) {
		return new TypeDescriptor(kind, Precision.DEFAULT, 0, Shape.SCALAR, MemoryOrder.NONE);
	}

	public static TypeDescriptor scalar(ElementKind kind, int bits) {
		return new TypeDescriptor(kind, Precision.ofBits(bits), 0, Shape.SCALAR, MemoryOrder.NONE);
	}

	public static TypeDescriptor array(ElementKind kind, Precision precision, int rank, MemoryOrder order) {
		return new TypeDescriptor(kind, precision, rank, Shape.UNKNOWN, order);
	}

	public static TypeDescriptor array(ElementKind kind, Precision precision, Shape shape, MemoryOrder order) {
		return new TypeDescriptor(kind, precision, shape.dimensions().size(), shape, order);
	}

	public boolean isScalar() {
		return rank == 0;
	}

	/** Same element type with rank zero. */
	public TypeDescriptor element() {
		return new TypeDescriptor(kind, precision, 0, Shape.SCALAR, MemoryOrder.NONE);
	}

	/**
	 * Whether a value of this type needs an explicit conversion to become
	 * {@code targetKind}/{@code targetPrecision}. Default precision compares as
	 * the kind's native width.
	 */
	public boolean requiresCast(ElementKind targetKind, Precision targetPrecision) {
		if (kind != targetKind) {
			return true;
		}
		return precision.resolve(kind) != targetPrecision.resolve(targetKind);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(kind.name().toLowerCase());
		if (!precision.isDefault()) {
			sb.append(precision.bits());
		}
		if (rank > 0) {
			sb.append('[').append(":,".repeat(rank - 1)).append(':').append(']');
			if (order != MemoryOrder.NONE) {
				sb.append(" order(").append(order.flag()).append(')');
			}
		}
		return sb.toString();
	}
}
