package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

/**
 * {@code owner.name} on a class instance.
 */
public final class AttributeAccess extends Node implements TypedValue {
	private final String name;
	private final TypeDescriptor type;

	public AttributeAccess(Node owner, String name, TypeDescriptor type, SourceSpan span) {
		super(span);
		this.name = name;
		this.type = type;
		own("owner", owner);
	}

	public Node owner() {
		return child("owner", Node.class);
	}

	public String name() {
		return name;
	}

	@Override
	public TypeDescriptor type() {
		return type;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitAttributeAccess(this);
	}
}
