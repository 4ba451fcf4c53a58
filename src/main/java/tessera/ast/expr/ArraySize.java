package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.ElementKind;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

/** Total number of elements of an array. */
public final class ArraySize extends Node implements TypedValue {
	private static final TypeDescriptor TYPE = TypeDescriptor.scalar(ElementKind.INTEGER);

	public ArraySize(Node array, SourceSpan span) {
		super(span);
		own("array", array);
	}

	public ArraySize(Node array) {
		this(array, SourceSpan.NONE);
	}

	public Node array() {
		return child("array", Node.class);
	}

	@Override
	public TypeDescriptor type() {
		return TYPE;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitArraySize(this);
	}
}
