package tessera.ast;

/**
 * Pipeline stage a node graph belongs to. Semantic-stage nodes are validated
 * against their resolved types when they are added to the graph.
 */
public enum Stage {
	SYNTACTIC,
	SEMANTIC
}
