package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

public final class Continue extends Node {
	public Continue(SourceSpan span) {
		super(span);
	}

	public Continue() {
		this(SourceSpan.NONE);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitContinue(this);
	}
}
