package tessera.ast.expr;

import tessera.ast.Node;

import java.util.List;

/**
 * A construct represented internally by an explicit loop nest over index
 * variables.
 */
public interface HasLoopNest {
	Node loopNest();

	List<Variable> indices();
}
