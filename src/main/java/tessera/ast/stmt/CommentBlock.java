package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

import java.util.List;

/** Multi-line comment; used for docstrings. */
public final class CommentBlock extends Node {
	private final List<String> lines;

	public CommentBlock(List<String> lines, SourceSpan span) {
		super(span);
		this.lines = List.copyOf(lines);
	}

	public CommentBlock(String text) {
		this(List.of(text.split("\n", -1)), SourceSpan.NONE);
	}

	public List<String> lines() {
		return lines;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitCommentBlock(this);
	}
}
