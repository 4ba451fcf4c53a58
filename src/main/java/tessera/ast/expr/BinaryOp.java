package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

import java.util.List;

/**
 * An n-ary application of one binary operator: {@code a op b op c}.
 */
public final class BinaryOp extends Node implements TypedValue {
	private final Operator op;
	private final TypeDescriptor type;

	public BinaryOp(Operator op, List<? extends Node> args, TypeDescriptor type, SourceSpan span) {
		super(span);
		if (args.size() < 2) {
			throw new IllegalArgumentException(op + " needs at least two operands");
		}
		this.op = op;
		this.type = type;
		ownAll("args", args);
	}

	public BinaryOp(Operator op, Node left, Node right, TypeDescriptor type) {
		this(op, List.of(left, right), type, SourceSpan.NONE);
	}

	public Operator op() {
		return op;
	}

	public List<Node> args() {
		return children("args", Node.class);
	}

	@Override
	public TypeDescriptor type() {
		return type;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitBinaryOp(this);
	}
}
