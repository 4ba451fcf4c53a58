package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.ElementKind;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

import java.util.List;

/**
 * Call of a user-defined function, or a method when a receiver is present. A
 * call typed {@link ElementKind#VOID} is used as a statement.
 */
public final class FunctionCall extends Node implements TypedValue, Elemental {
	private final String name;
	private final TypeDescriptor type;
	private final boolean elemental;

	public FunctionCall(Node receiver, String name, List<? extends Node> args, TypeDescriptor type,
			boolean elemental, SourceSpan span) {
		super(span);
		this.name = name;
		this.type = type;
		this.elemental = elemental;
		own("receiver", receiver);
		ownAll("args", args);
	}

	public FunctionCall(String name, List<? extends Node> args, TypeDescriptor type) {
		this(null, name, args, type, false, SourceSpan.NONE);
	}

	public Node receiver() {
		return child("receiver", Node.class);
	}

	public String name() {
		return name;
	}

	public List<Node> args() {
		return children("args", Node.class);
	}

	public boolean isStatement() {
		return type.kind() == ElementKind.VOID;
	}

	@Override
	public boolean isElemental() {
		return elemental;
	}

	@Override
	public TypeDescriptor type() {
		return type;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitFunctionCall(this);
	}
}
