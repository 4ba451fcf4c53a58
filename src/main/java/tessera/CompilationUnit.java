package tessera;

import tessera.ast.NodeGraph;
import tessera.ast.decl.Module;

import java.util.List;

/**
 * One translation unit handed over by the semantic stage: its graph, the root
 * module registered in it, and the directive comments still to attach.
 */
public record CompilationUnit(String name, NodeGraph graph, Module root, List<PendingDirective> directives) {
	public CompilationUnit {
		if (!graph.contains(root)) {
			throw new IllegalArgumentException("the root module of " + name + " is not part of its graph");
		}
		directives = List.copyOf(directives);
	}

	public CompilationUnit(String name, NodeGraph graph, Module root) {
		this(name, graph, root, List.of());
	}
}
