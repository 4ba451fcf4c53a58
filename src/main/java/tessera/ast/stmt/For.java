package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.ScopedNode;
import tessera.ast.SourceSpan;
import tessera.ast.expr.Variable;

import java.util.List;

/**
 * {@code for targets in iterable: body}. Usually a single target iterating a
 * {@link tessera.ast.expr.Range}.
 */
public final class For extends Node implements ScopedNode {
	public For(List<Variable> targets, Node iterable, CodeBlock body, SourceSpan span) {
		super(span);
		if (targets.isEmpty()) {
			throw new IllegalArgumentException("a loop needs at least one target");
		}
		ownAll("targets", targets);
		own("iterable", iterable);
		own("body", body);
	}

	public For(Variable target, Node iterable, CodeBlock body) {
		this(List.of(target), iterable, body, SourceSpan.NONE);
	}

	public List<Variable> targets() {
		return children("targets", Variable.class);
	}

	public Node iterable() {
		return child("iterable", Node.class);
	}

	public CodeBlock body() {
		return child("body", CodeBlock.class);
	}

	@Override
	public String scopeLabel() {
		return "for";
	}

	@Override
	public List<Variable> scopeVariables() {
		return targets();
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitFor(this);
	}
}
