package tessera.ast.stmt;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;

import java.util.List;

/**
 * Launch of an offload kernel: {@code name[blocks, threads](args)}.
 */
public final class KernelCall extends Node {
	private final String name;

	public KernelCall(String name, Node blocks, Node threads, List<? extends Node> args, SourceSpan span) {
		super(span);
		this.name = name;
		own("blocks", blocks);
		own("threads", threads);
		ownAll("args", args);
	}

	public KernelCall(String name, Node blocks, Node threads, List<? extends Node> args) {
		this(name, blocks, threads, args, SourceSpan.NONE);
	}

	public String name() {
		return name;
	}

	public Node blocks() {
		return child("blocks", Node.class);
	}

	public Node threads() {
		return child("threads", Node.class);
	}

	public List<Node> args() {
		return children("args", Node.class);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitKernelCall(this);
	}
}
