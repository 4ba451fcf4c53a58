package tessera.ast.decl;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.ast.expr.Variable;

/**
 * A formal argument. {@code annotation} is the source-level type annotation
 * text, if any.
 */
public final class FunctionArgument extends Node {
	private final String annotation;

	public FunctionArgument(Variable variable, String annotation, Node defaultValue, SourceSpan span) {
		super(span);
		this.annotation = annotation;
		own("variable", variable);
		own("default", defaultValue);
	}

	public FunctionArgument(Variable variable) {
		this(variable, null, null, SourceSpan.NONE);
	}

	public Variable variable() {
		return child("variable", Variable.class);
	}

	public String annotation() {
		return annotation;
	}

	public Node defaultValue() {
		return child("default", Node.class);
	}

	public boolean hasDefault() {
		return defaultValue() != null;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitFunctionArgument(this);
	}
}
