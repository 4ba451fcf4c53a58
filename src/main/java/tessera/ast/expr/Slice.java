package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.ast.Stage;
import tessera.types.ElementKind;
import tessera.types.TypedValue;

/**
 * {@code start:stop:step}, each bound optional. In the semantic stage every
 * present bound must be an integer value.
 */
public final class Slice extends Node {
	public Slice(Node start, Node stop, Node step, SourceSpan span) {
		super(span);
		own("start", start);
		own("stop", stop);
		own("step", step);
	}

	public Slice(Node start, Node stop, Node step) {
		this(start, stop, step, SourceSpan.NONE);
	}

	public Node start() {
		return child("start", Node.class);
	}

	public Node stop() {
		return child("stop", Node.class);
	}

	public Node step() {
		return child("step", Node.class);
	}

	@Override
	protected void validate(Stage stage) {
		if (stage == Stage.SYNTACTIC) {
			return;
		}
		requireInteger("start", start());
		requireInteger("stop", stop());
		requireInteger("step", step());
	}

	private static void requireInteger(String bound, Node value) {
		if (value == null) {
			return;
		}
		if (!(value instanceof TypedValue typed) || typed.type().kind() != ElementKind.INTEGER) {
			throw new IllegalArgumentException("Slice " + bound + " must be an integer or absent");
		}
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitSlice(this);
	}
}
