package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

import java.util.List;

public final class LibraryCall extends Node implements TypedValue, Elemental {
	private final LibraryFunction function;
	private final TypeDescriptor type;

	public LibraryCall(LibraryFunction function, List<? extends Node> args, TypeDescriptor type, SourceSpan span) {
		super(span);
		this.function = function;
		this.type = type;
		ownAll("args", args);
	}

	public LibraryCall(LibraryFunction function, List<? extends Node> args, TypeDescriptor type) {
		this(function, args, type, SourceSpan.NONE);
	}

	public LibraryFunction function() {
		return function;
	}

	public List<Node> args() {
		return children("args", Node.class);
	}

	@Override
	public boolean isElemental() {
		return function.elemental();
	}

	@Override
	public TypeDescriptor type() {
		return type;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitLibraryCall(this);
	}
}
