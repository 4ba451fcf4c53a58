package tessera.ast.decl;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.ScopedNode;
import tessera.ast.SourceSpan;
import tessera.ast.expr.Variable;

import java.util.List;

public final class ClassDef extends Node implements ScopedNode {
	private final String name;
	private final List<String> superclasses;

	public ClassDef(String name, List<String> superclasses, List<Variable> attributes, List<FunctionDef> methods,
			List<Interface> interfaces, SourceSpan span) {
		super(span);
		this.name = name;
		this.superclasses = List.copyOf(superclasses);
		ownAll("attributes", attributes);
		ownAll("methods", methods);
		ownAll("interfaces", interfaces);
	}

	public String name() {
		return name;
	}

	public List<String> superclasses() {
		return superclasses;
	}

	public List<Variable> attributes() {
		return children("attributes", Variable.class);
	}

	public List<FunctionDef> methods() {
		return children("methods", FunctionDef.class);
	}

	public List<Interface> interfaces() {
		return children("interfaces", Interface.class);
	}

	@Override
	public String scopeLabel() {
		return name;
	}

	@Override
	public List<Variable> scopeVariables() {
		return attributes();
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitClassDef(this);
	}
}
