package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.ast.expr.Variable;

import java.util.List;

/** Releases variables; arrays are deallocated by the C target. */
public final class Del extends Node {
	public Del(List<Variable> variables, SourceSpan span) {
		super(span);
		ownAll("variables", variables);
	}

	public Del(List<Variable> variables) {
		this(variables, SourceSpan.NONE);
	}

	public List<Variable> variables() {
		return children("variables", Variable.class);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitDel(this);
	}
}
