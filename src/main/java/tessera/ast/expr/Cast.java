package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.ElementKind;
import tessera.types.Precision;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

/**
 * Explicit conversion inserted upstream. Keeps the argument's rank, shape and
 * order.
 */
public final class Cast extends Node implements TypedValue, Elemental {
	private final TypeDescriptor type;

	public Cast(ElementKind kind, Precision precision, Node arg, SourceSpan span) {
		super(span);
		TypeDescriptor from = ((TypedValue) arg).type();
		this.type = new TypeDescriptor(kind, precision, from.rank(), from.shape(), from.order());
		own("arg", arg);
	}

	public Cast(ElementKind kind, Precision precision, Node arg) {
		this(kind, precision, arg, SourceSpan.NONE);
	}

	public Node arg() {
		return child("arg", Node.class);
	}

	@Override
	public TypeDescriptor type() {
		return type;
	}

	@Override
	public boolean isElemental() {
		return true;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitCast(this);
	}
}
