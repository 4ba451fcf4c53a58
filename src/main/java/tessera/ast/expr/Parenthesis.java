package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

/**
 * Explicit grouping kept from the source.
 */
public final class Parenthesis extends Node implements TypedValue {
	public Parenthesis(Node arg, SourceSpan span) {
		super(span);
		if (!(arg instanceof TypedValue)) {
			throw new IllegalArgumentException("only typed values can be grouped");
		}
		own("arg", arg);
	}

	public Parenthesis(Node arg) {
		this(arg, SourceSpan.NONE);
	}

	public Node arg() {
		return child("arg", Node.class);
	}

	@Override
	public TypeDescriptor type() {
		return child("arg", TypedValue.class).type();
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitParenthesis(this);
	}
}
