package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

/**
 * {@code lhs = rhs}. The target is a variable, an indexed element or an
 * attribute.
 */
public final class Assign extends Node {
	public Assign(Node lhs, Node rhs, SourceSpan span) {
		super(span);
		own("lhs", lhs);
		own("rhs", rhs);
	}

	public Assign(Node lhs, Node rhs) {
		this(lhs, rhs, SourceSpan.NONE);
	}

	public Node lhs() {
		return child("lhs", Node.class);
	}

	public Node rhs() {
		return child("rhs", Node.class);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitAssign(this);
	}
}
