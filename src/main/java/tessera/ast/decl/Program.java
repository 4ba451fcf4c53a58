package tessera.ast.decl;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.ScopedNode;
import tessera.ast.SourceSpan;
import tessera.ast.expr.Variable;
import tessera.ast.stmt.CodeBlock;

import java.util.List;

/** The executable part of a module ({@code __main__} block). */
public final class Program extends Node implements ScopedNode {
	private final String name;

	public Program(String name, List<Import> imports, List<Variable> variables, CodeBlock body, SourceSpan span) {
		super(span);
		this.name = name;
		ownAll("imports", imports);
		ownAll("variables", variables);
		own("body", body);
	}

	public Program(String name, CodeBlock body) {
		this(name, List.of(), List.of(), body, SourceSpan.NONE);
	}

	public String name() {
		return name;
	}

	public List<Import> imports() {
		return children("imports", Import.class);
	}

	public List<Variable> variables() {
		return children("variables", Variable.class);
	}

	public CodeBlock body() {
		return child("body", CodeBlock.class);
	}

	@Override
	public String scopeLabel() {
		return name;
	}

	@Override
	public List<Variable> scopeVariables() {
		return variables();
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitProgram(this);
	}
}
