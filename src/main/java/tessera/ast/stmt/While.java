package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.ScopedNode;
import tessera.ast.SourceSpan;
import tessera.ast.expr.Variable;

import java.util.List;

public final class While extends Node implements ScopedNode {
	public While(Node condition, CodeBlock body, SourceSpan span) {
		super(span);
		own("condition", condition);
		own("body", body);
	}

	public While(Node condition, CodeBlock body) {
		this(condition, body, SourceSpan.NONE);
	}

	public Node condition() {
		return child("condition", Node.class);
	}

	public CodeBlock body() {
		return child("body", CodeBlock.class);
	}

	@Override
	public String scopeLabel() {
		return "while";
	}

	@Override
	public List<Variable> scopeVariables() {
		return List.of();
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitWhile(this);
	}
}
