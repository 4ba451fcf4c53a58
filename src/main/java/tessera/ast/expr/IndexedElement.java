package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

import java.util.List;

/**
 * {@code base[i, j]}; an index is either an integer value or a {@link Slice}.
 */
public final class IndexedElement extends Node implements TypedValue {
	private final TypeDescriptor type;

	public IndexedElement(Node base, List<? extends Node> indices, TypeDescriptor type, SourceSpan span) {
		super(span);
		if (indices.isEmpty()) {
			throw new IllegalArgumentException("indexing needs at least one index");
		}
		this.type = type;
		own("base", base);
		ownAll("indices", indices);
	}

	public Node base() {
		return child("base", Node.class);
	}

	public List<Node> indices() {
		return children("indices", Node.class);
	}

	public boolean isSliced() {
		return indices().stream().anyMatch(Slice.class::isInstance);
	}

	@Override
	public TypeDescriptor type() {
		return type;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitIndexedElement(this);
	}
}
