package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

import java.util.List;

/**
 * A list comprehension or generator reduction.
 *
 * The semantic stage has already desugared it: {@code loopNest} computes the
 * element for each combination of {@code indices} and combines it into
 * {@code accumulator}, after the statements in {@code setup} (accumulator
 * initialisation) have run. {@code lhs} is the variable receiving the result.
 */
public final class Comprehension extends Node implements TypedValue, HasLoopNest, AtomicValue {
	private final CombinationMode mode;
	private final TypeDescriptor type;

	public Comprehension(CombinationMode mode, List<? extends Node> setup, Node loopNest, Variable lhs,
			List<Variable> indices, Variable accumulator, TypeDescriptor type, SourceSpan span) {
		super(span);
		if (loopNest == null) {
			throw new IllegalArgumentException("a comprehension needs a loop nest");
		}
		this.mode = mode;
		this.type = type;
		ownAll("setup", setup);
		own("loopNest", loopNest);
		own("lhs", lhs);
		ownAll("indices", indices);
		own("accumulator", accumulator);
	}

	public CombinationMode mode() {
		return mode;
	}

	public List<Node> setup() {
		return children("setup", Node.class);
	}

	@Override
	public Node loopNest() {
		return child("loopNest", Node.class);
	}

	public Variable lhs() {
		return child("lhs", Variable.class);
	}

	@Override
	public List<Variable> indices() {
		return children("indices", Variable.class);
	}

	public Variable accumulator() {
		return child("accumulator", Variable.class);
	}

	@Override
	public boolean isAtomic() {
		return mode != CombinationMode.COLLECT;
	}

	@Override
	public TypeDescriptor type() {
		return type;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitComprehension(this);
	}
}
