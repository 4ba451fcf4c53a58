package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

public final class TernaryOp extends Node implements TypedValue {
	private final TypeDescriptor type;

	public TernaryOp(Node condition, Node ifTrue, Node ifFalse, TypeDescriptor type, SourceSpan span) {
		super(span);
		this.type = type;
		own("condition", condition);
		own("ifTrue", ifTrue);
		own("ifFalse", ifFalse);
	}

	public Node condition() {
		return child("condition", Node.class);
	}

	public Node ifTrue() {
		return child("ifTrue", Node.class);
	}

	public Node ifFalse() {
		return child("ifFalse", Node.class);
	}

	@Override
	public TypeDescriptor type() {
		return type;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitTernaryOp(this);
	}
}
