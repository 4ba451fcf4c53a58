package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

/**
 * An identifier with no type: a module, function or variable name used before
 * or independently of type resolution.
 */
public final class Symbol extends Node {
	private final String name;

	public Symbol(String name, SourceSpan span) {
		super(span);
		this.name = name;
	}

	public Symbol(String name) {
		this(name, SourceSpan.NONE);
	}

	public String name() {
		return name;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitSymbol(this);
	}
}
