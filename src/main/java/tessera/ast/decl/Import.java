package tessera.ast.decl;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

import java.util.List;

/**
 * {@code from source import a, b as c}, or {@code import source} when there
 * are no targets.
 */
public final class Import extends Node {
	private final String source;
	private final List<ImportTarget> targets;

	public Import(String source, List<ImportTarget> targets, SourceSpan span) {
		super(span);
		this.source = source;
		this.targets = List.copyOf(targets);
	}

	public Import(String source, ImportTarget... targets) {
		this(source, List.of(targets), SourceSpan.NONE);
	}

	public String source() {
		return source;
	}

	public List<ImportTarget> targets() {
		return targets;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitImport(this);
	}
}
