package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.directive.DirectiveComment;

/**
 * A parsed parallel directive. It owns no children and is never placed in a
 * slot: the graph attaches it to the node it annotates.
 */
public final class Directive extends Node {
	private final DirectiveComment comment;

	public Directive(DirectiveComment comment, SourceSpan span) {
		super(span);
		this.comment = comment;
	}

	public DirectiveComment comment() {
		return comment;
	}

	public boolean isEnd() {
		return comment.end();
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitDirective(this);
	}
}
