package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

public final class Break extends Node {
	public Break(SourceSpan span) {
		super(span);
	}

	public Break() {
		this(SourceSpan.NONE);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitBreak(this);
	}
}
