package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

import java.util.List;

/** Ordered statements. */
public final class CodeBlock extends Node {
	public CodeBlock(List<? extends Node> body, SourceSpan span) {
		super(span);
		ownAll("body", body);
	}

	public CodeBlock(List<? extends Node> body) {
		this(body, SourceSpan.NONE);
	}

	public static CodeBlock of(Node... body) {
		return new CodeBlock(List.of(body));
	}

	public List<Node> body() {
		return children("body", Node.class);
	}

	public boolean isEmpty() {
		return body().isEmpty();
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitCodeBlock(this);
	}
}
