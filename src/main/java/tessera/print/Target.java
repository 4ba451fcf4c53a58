package tessera.print;

import tessera.ast.NodeGraph;
import tessera.diag.Diagnostics;

import java.util.Set;

/** Supported output languages. */
public enum Target {
	PYTHON("python", Set.of(
			"False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue", "def",
			"del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in", "is",
			"lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield")),
	C("c", Set.of(
			"auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else", "enum",
			"extern", "float", "for", "goto", "if", "inline", "int", "long", "register", "restrict", "return",
			"short", "signed", "sizeof", "static", "struct", "switch", "typedef", "union", "unsigned", "void",
			"volatile", "while", "bool", "true", "false", "complex", "main", "NULL"));

	private final String label;
	private final Set<String> reservedWords;

	Target(String label, Set<String> reservedWords) {
		this.label = label;
		this.reservedWords = reservedWords;
	}

	public String label() {
		return label;
	}

	public Set<String> reservedWords() {
		return reservedWords;
	}

	public CodePrinter newPrinter(NodeGraph graph, Diagnostics diagnostics, int indentWidth) {
		switch (this) {
			case C:
				return new CPrinter(graph, diagnostics, indentWidth);
			default:
				return new PythonPrinter(graph, diagnostics, indentWidth);
		}
	}

	public static Target of(String label) {
		for (Target t : values()) {
			if (t.label.equals(label)) {
				return t;
			}
		}
		throw new IllegalArgumentException("unknown target: " + label);
	}
}
