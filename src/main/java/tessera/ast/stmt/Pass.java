package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

public final class Pass extends Node {
	public Pass(SourceSpan span) {
		super(span);
	}

	public Pass() {
		this(SourceSpan.NONE);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitPass(this);
	}
}
