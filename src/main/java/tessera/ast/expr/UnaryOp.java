package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

public final class UnaryOp extends Node implements TypedValue {
	private final UnaryOperator op;
	private final TypeDescriptor type;

	public UnaryOp(UnaryOperator op, Node arg, TypeDescriptor type, SourceSpan span) {
		super(span);
		this.op = op;
		this.type = type;
		own("arg", arg);
	}

	public UnaryOperator op() {
		return op;
	}

	public Node arg() {
		return child("arg", Node.class);
	}

	@Override
	public TypeDescriptor type() {
		return type;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitUnaryOp(this);
	}
}
