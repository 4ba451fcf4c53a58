package tessera.ast.decl;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.ScopedNode;
import tessera.ast.SourceSpan;
import tessera.ast.expr.Variable;
import tessera.ast.stmt.CodeBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a compilation unit.
 */
public final class Module extends Node implements ScopedNode {
	private final String name;

	private Module(Builder b) {
		super(b.span);
		this.name = b.name;
		ownAll("imports", b.imports);
		ownAll("variables", b.variables);
		ownAll("functions", b.functions);
		ownAll("interfaces", b.interfaces);
		ownAll("classes", b.classes);
		own("initBody", b.initBody == null ? new CodeBlock(List.of()) : b.initBody);
		own("program", b.program);
	}

	public static Builder builder(String name) {
		return new Builder(name);
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

	public List<FunctionDef> functions() {
		return children("functions", FunctionDef.class);
	}

	public List<Interface> interfaces() {
		return children("interfaces", Interface.class);
	}

	public List<ClassDef> classes() {
		return children("classes", ClassDef.class);
	}

	public CodeBlock initBody() {
		return child("initBody", CodeBlock.class);
	}

	public Program program() {
		return child("program", Program.class);
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
		return visitor.visitModule(this);
	}

	public static final class Builder {
		private final String name;
		private final List<Import> imports = new ArrayList<>();
		private final List<Variable> variables = new ArrayList<>();
		private final List<FunctionDef> functions = new ArrayList<>();
		private final List<Interface> interfaces = new ArrayList<>();
		private final List<ClassDef> classes = new ArrayList<>();
		private CodeBlock initBody;
		private Program program;
		private SourceSpan span = SourceSpan.NONE;

		private Builder(String name) {
			this.name = name;
		}

		public Builder imports(Import imp) {
			imports.add(imp);
			return this;
		}

		public Builder variable(Variable variable) {
			variables.add(variable);
			return this;
		}

		public Builder function(FunctionDef function) {
			functions.add(function);
			return this;
		}

		public Builder iface(Interface iface) {
			interfaces.add(iface);
			return this;
		}

		public Builder classDef(ClassDef classDef) {
			classes.add(classDef);
			return this;
		}

		public Builder initBody(CodeBlock initBody) {
			this.initBody = initBody;
			return this;
		}

		public Builder program(Program program) {
			this.program = program;
			return this;
		}

		public Builder span(SourceSpan span) {
			this.span = span;
			return this;
		}

		public Module build() {
			return new Module(this);
		}
	}
}
