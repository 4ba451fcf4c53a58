package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

/**
 * {@code keyword=value} in a call.
 */
public final class CallArgument extends Node {
	private final String keyword;

	public CallArgument(String keyword, Node value, SourceSpan span) {
		super(span);
		this.keyword = keyword;
		own("value", value);
	}

	public CallArgument(String keyword, Node value) {
		this(keyword, value, SourceSpan.NONE);
	}

	public String keyword() {
		return keyword;
	}

	public Node value() {
		return child("value", Node.class);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitCallArgument(this);
	}
}
