package tessera.ast;

import tessera.ast.expr.Variable;

import java.util.List;

/**
 * A construct that opens a lexical scope while it is walked (function, loop,
 * class, module, program).
 */
public interface ScopedNode {
	String scopeLabel();

	/** Variables introduced by the construct itself. */
	List<Variable> scopeVariables();
}
