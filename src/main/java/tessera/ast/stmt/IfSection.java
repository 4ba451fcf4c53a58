package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

/** One {@code condition: body} arm of an {@link If}. */
public final class IfSection extends Node {
	public IfSection(Node condition, CodeBlock body, SourceSpan span) {
		super(span);
		own("condition", condition);
		own("body", body);
	}

	public IfSection(Node condition, CodeBlock body) {
		this(condition, body, SourceSpan.NONE);
	}

	public Node condition() {
		return child("condition", Node.class);
	}

	public CodeBlock body() {
		return child("body", CodeBlock.class);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitIfSection(this);
	}
}
