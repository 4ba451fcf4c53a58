package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

/**
 * {@code range(start, stop, step)}. Only meaningful as the iterable of a loop.
 */
public final class Range extends Node {
	public Range(Node start, Node stop, Node step, SourceSpan span) {
		super(span);
		own("start", start);
		own("stop", stop);
		own("step", step);
	}

	public Range(Node start, Node stop) {
		this(start, stop, null, SourceSpan.NONE);
	}

	public Node start() {
		return child("start", Node.class);
	}

	public Node stop() {
		return child("stop", Node.class);
	}

	/** Null means a step of one. */
	public Node step() {
		return child("step", Node.class);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitRange(this);
	}
}
