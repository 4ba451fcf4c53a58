package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.ElementKind;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

/** Extent of an array along one dimension. */
public final class ArrayShapeElement extends Node implements TypedValue {
	private static final TypeDescriptor TYPE = TypeDescriptor.scalar(ElementKind.INTEGER);

	public ArrayShapeElement(Node array, Node index, SourceSpan span) {
		super(span);
		own("array", array);
		own("index", index);
	}

	public ArrayShapeElement(Node array, Node index) {
		this(array, index, SourceSpan.NONE);
	}

	public Node array() {
		return child("array", Node.class);
	}

	public Node index() {
		return child("index", Node.class);
	}

	@Override
	public TypeDescriptor type() {
		return TYPE;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitArrayShapeElement(this);
	}
}
