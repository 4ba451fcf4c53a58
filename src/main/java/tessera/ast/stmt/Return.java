package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

import java.util.List;

public final class Return extends Node {
	public Return(List<? extends Node> values, SourceSpan span) {
		super(span);
		ownAll("values", values);
	}

	public Return(List<? extends Node> values) {
		this(values, SourceSpan.NONE);
	}

	public List<Node> values() {
		return children("values", Node.class);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitReturn(this);
	}
}
