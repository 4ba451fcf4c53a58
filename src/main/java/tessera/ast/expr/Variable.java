package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

public final class Variable extends Node implements TypedValue {
	private final String name;
	private final TypeDescriptor type;

	public Variable(String name, TypeDescriptor type, SourceSpan span) {
		super(span);
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("variable name must not be empty");
		}
		this.name = name;
		this.type = type;
	}

	public Variable(String name, TypeDescriptor type) {
		this(name, type, SourceSpan.NONE);
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
		return visitor.visitVariable(this);
	}

	@Override
	public String toString() {
		return name + "#" + id();
	}
}
