package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

/** A single-line comment kept from the source, without its marker. */
public final class Comment extends Node {
	private final String text;

	public Comment(String text, SourceSpan span) {
		super(span);
		this.text = text;
	}

	public Comment(String text) {
		this(text, SourceSpan.NONE);
	}

	public String text() {
		return text;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitComment(this);
	}
}
