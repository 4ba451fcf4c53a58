package tessera.ast.decl;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

import java.util.List;

/**
 * A group of functions sharing one name: overloads, or the instantiations of a
 * template.
 */
public final class Interface extends Node {
	private final String name;

	public Interface(String name, List<FunctionDef> functions, SourceSpan span) {
		super(span);
		this.name = name;
		ownAll("functions", functions);
	}

	public Interface(String name, List<FunctionDef> functions) {
		this(name, functions, SourceSpan.NONE);
	}

	public String name() {
		return name;
	}

	public List<FunctionDef> functions() {
		return children("functions", FunctionDef.class);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitInterface(this);
	}
}
