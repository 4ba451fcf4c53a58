package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

import java.util.List;

/**
 * if/elif/else chain. An {@code else} arm is a final section whose condition
 * is the literal {@code True}.
 */
public final class If extends Node {
	public If(List<IfSection> sections, SourceSpan span) {
		super(span);
		if (sections.isEmpty()) {
			throw new IllegalArgumentException("an if needs at least one section");
		}
		ownAll("sections", sections);
	}

	public If(List<IfSection> sections) {
		this(sections, SourceSpan.NONE);
	}

	public List<IfSection> sections() {
		return children("sections", IfSection.class);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitIf(this);
	}
}
