package tessera;

import tessera.ast.Node;

/** A directive comment as written, and the node it annotates. */
public record PendingDirective(String text, int line, Node target) {
}
