package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.ast.expr.Variable;

/**
 * Binds a pointer variable to existing storage without copying.
 */
public final class AliasAssign extends Node {
	public AliasAssign(Variable lhs, Node rhs, SourceSpan span) {
		super(span);
		own("lhs", lhs);
		own("rhs", rhs);
	}

	public AliasAssign(Variable lhs, Node rhs) {
		this(lhs, rhs, SourceSpan.NONE);
	}

	public Variable lhs() {
		return child("lhs", Variable.class);
	}

	public Node rhs() {
		return child("rhs", Node.class);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitAliasAssign(this);
	}
}
