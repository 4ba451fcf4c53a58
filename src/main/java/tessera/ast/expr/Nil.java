package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

/** The absent value ({@code None}). */
public final class Nil extends Node {
	public Nil(SourceSpan span) {
		super(span);
	}

	public Nil() {
		this(SourceSpan.NONE);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitNil(this);
	}
}
