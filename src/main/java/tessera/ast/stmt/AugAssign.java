package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.ast.expr.Operator;

/** {@code lhs op= rhs}. */
public final class AugAssign extends Node {
	private final Operator op;

	public AugAssign(Node lhs, Operator op, Node rhs, SourceSpan span) {
		super(span);
		this.op = op;
		own("lhs", lhs);
		own("rhs", rhs);
	}

	public AugAssign(Node lhs, Operator op, Node rhs) {
		this(lhs, op, rhs, SourceSpan.NONE);
	}

	public Operator op() {
		return op;
	}

	public Node lhs() {
		return child("lhs", Node.class);
	}

	public Node rhs() {
		return child("rhs", Node.class);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitAugAssign(this);
	}
}
