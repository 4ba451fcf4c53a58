package tessera.ast.decl;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.ScopedNode;
import tessera.ast.SourceSpan;
import tessera.ast.expr.Variable;
import tessera.ast.stmt.CodeBlock;
import tessera.ast.stmt.CommentBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * A function definition with its nested declarations. Decorators are kept
 * most recently processed first, the order in which they are printed.
 */
public final class FunctionDef extends Node implements ScopedNode {
	private final String name;
	private final List<Decorator> decorators;

	private FunctionDef(Builder b) {
		super(b.span);
		this.name = b.name;
		this.decorators = List.copyOf(b.decorators);
		ownAll("arguments", b.arguments);
		ownAll("results", b.results);
		ownAll("locals", b.locals);
		own("body", b.body == null ? new CodeBlock(List.of()) : b.body);
		ownAll("imports", b.imports);
		ownAll("functions", b.functions);
		ownAll("interfaces", b.interfaces);
		own("docstring", b.docstring);
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	public String name() {
		return name;
	}

	public List<Decorator> decorators() {
		return decorators;
	}

	public List<FunctionArgument> arguments() {
		return children("arguments", FunctionArgument.class);
	}

	public List<Variable> results() {
		return children("results", Variable.class);
	}

	/** Variables declared in the body, in declaration order. */
	public List<Variable> locals() {
		return children("locals", Variable.class);
	}

	public CodeBlock body() {
		return child("body", CodeBlock.class);
	}

	public List<Import> imports() {
		return children("imports", Import.class);
	}

	public List<FunctionDef> functions() {
		return children("functions", FunctionDef.class);
	}

	public List<Interface> interfaces() {
		return children("interfaces", Interface.class);
	}

	public CommentBlock docstring() {
		return child("docstring", CommentBlock.class);
	}

	@Override
	public String scopeLabel() {
		return name;
	}

	@Override
	public List<Variable> scopeVariables() {
		List<Variable> out = new ArrayList<>();
		for (FunctionArgument a : arguments()) {
			out.add(a.variable());
		}
		for (Variable r : results()) {
			if (!out.contains(r)) {
				out.add(r);
			}
		}
		for (Variable l : locals()) {
			if (!out.contains(l)) {
				out.add(l);
			}
		}
		return out;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitFunctionDef(this);
	}

	public static final class Builder {
		private final String name;
		private final List<FunctionArgument> arguments = new ArrayList<>();
		private final List<Variable> results = new ArrayList<>();
		private final List<Variable> locals = new ArrayList<>();
		private final List<Import> imports = new ArrayList<>();
		private final List<FunctionDef> functions = new ArrayList<>();
		private final List<Interface> interfaces = new ArrayList<>();
		private final List<Decorator> decorators = new ArrayList<>();
		private CodeBlock body;
		private CommentBlock docstring;
		private SourceSpan span = SourceSpan.NONE;

		private Builder(String name) {
			this.name = name;
		}

		public Builder argument(FunctionArgument argument) {
			arguments.add(argument);
			return this;
		}

		public Builder argument(Variable variable) {
			return argument(new FunctionArgument(variable));
		}

		public Builder result(Variable result) {
			results.add(result);
			return this;
		}

		public Builder local(Variable local) {
			locals.add(local);
			return this;
		}

		public Builder body(CodeBlock body) {
			this.body = body;
			return this;
		}

		public Builder imports(Import imp) {
			imports.add(imp);
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

		/** The most recently processed decorator comes first. */
		public Builder decorate(Decorator decorator) {
			decorators.add(0, decorator);
			return this;
		}

		public Builder docstring(CommentBlock docstring) {
			this.docstring = docstring;
			return this;
		}

		public Builder span(SourceSpan span) {
			this.span = span;
			return this;
		}

		public FunctionDef build() {
			return new FunctionDef(this);
		}
	}
}
