package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

import java.util.List;

public final class TupleLiteral extends Node implements TypedValue {
	private final TypeDescriptor type;

	public TupleLiteral(List<? extends Node> elements, TypeDescriptor type, SourceSpan span) {
		super(span);
		this.type = type;
		ownAll("elements", elements);
	}

	public TupleLiteral(List<? extends Node> elements, TypeDescriptor type) {
		this(elements, type, SourceSpan.NONE);
	}

	public List<Node> elements() {
		return children("elements", Node.class);
	}

	@Override
	public TypeDescriptor type() {
		return type;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitTupleLiteral(this);
	}
}
