package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

import java.util.List;

public final class Print extends Node {
	public Print(List<? extends Node> args, SourceSpan span) {
		super(span);
		ownAll("args", args);
	}

	public Print(List<? extends Node> args) {
		this(args, SourceSpan.NONE);
	}

	public List<Node> args() {
		return children("args", Node.class);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitPrint(this);
	}
}
