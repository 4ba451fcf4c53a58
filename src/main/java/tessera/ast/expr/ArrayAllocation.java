package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

import java.util.List;

/**
 * Creation of a new array. The element type, precision and order come from
 * the node's own type; {@code fill} is present only for {@link AllocationKind#FULL}.
 */
public final class ArrayAllocation extends Node implements TypedValue {
	private final AllocationKind allocation;
	private final TypeDescriptor type;

	public ArrayAllocation(AllocationKind allocation, List<? extends Node> shape, Node fill, TypeDescriptor type,
			SourceSpan span) {
		super(span);
		if ((allocation == AllocationKind.FULL) != (fill != null)) {
			throw new IllegalArgumentException("a fill value is required by, and only by, full()");
		}
		if (type.rank() != shape.size()) {
			throw new IllegalArgumentException("shape has " + shape.size() + " dimensions for rank " + type.rank());
		}
		this.allocation = allocation;
		this.type = type;
		ownAll("shape", shape);
		own("fill", fill);
	}

	public ArrayAllocation(AllocationKind allocation, List<? extends Node> shape, TypeDescriptor type) {
		this(allocation, shape, null, type, SourceSpan.NONE);
	}

	public AllocationKind allocation() {
		return allocation;
	}

	public List<Node> shape() {
		return children("shape", Node.class);
	}

	public Node fill() {
		return child("fill", Node.class);
	}

	@Override
	public TypeDescriptor type() {
		return type;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitArrayAllocation(this);
	}
}
