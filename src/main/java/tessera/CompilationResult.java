package tessera;

import tessera.diag.Diagnostics;
import tessera.print.ImportEntry;

import java.util.List;

/**
 * Output of one unit. When {@code complete} is false a fatal diagnostic
 * stopped the unit and {@code text} is empty.
 */
public record CompilationResult(String text, boolean complete, List<ImportEntry> imports, Diagnostics diagnostics) {
	public CompilationResult {
		imports = List.copyOf(imports);
	}

	static CompilationResult aborted(Diagnostics diagnostics) {
		return new CompilationResult("", false, List.of(), diagnostics);
	}
}
