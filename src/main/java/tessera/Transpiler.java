package tessera;

import org.apache.log4j.Logger;
import tessera.ast.StructuralViolationException;
import tessera.ast.stmt.Directive;
import tessera.diag.CompilationAbortedException;
import tessera.diag.Diagnostics;
import tessera.directive.DirectiveGrammar;
import tessera.directive.DirectiveProcessor;
import tessera.print.CodePrinter;

import java.util.ArrayList;
import java.util.List;

/**
 * Public entrypoint: attaches a unit's directives and prints it for the
 * configured target.
 *
 * Every unit gets its own diagnostics, scopes and imports, so one transpiler
 * may be reused for many units. Directives are attached to the unit's graph
 * only while it compiles and are detached again afterwards, so a unit can be
 * compiled again, for the same or another target.
 */
public final class Transpiler {
	private static final Logger LOG = Logger.getLogger(Transpiler.class);

	private final TranspilerConfig config;

	public Transpiler(TranspilerConfig config) {
		this.config = config;
	}

	public Transpiler() {
		this(TranspilerConfig.defaults());
	}

	public TranspilerConfig config() {
		return config;
	}

	public CompilationResult compile(CompilationUnit unit) {
		LOG.info("compiling " + unit.name() + " for " + config.target().label());
		Diagnostics diagnostics = new Diagnostics();
		List<Directive> attached = new ArrayList<>();
		try {
			DirectiveProcessor directives = new DirectiveProcessor(
					DirectiveGrammar.standard().schema(config.openmpVersion()), unit.graph(), diagnostics);
			for (PendingDirective pending : unit.directives()) {
				attached.add(directives.process(pending.text(), pending.line(), pending.target()));
			}
			CodePrinter printer = config.target().newPrinter(unit.graph(), diagnostics, config.indentWidth());
			String text = printer.print(unit.root());
			LOG.info("compiled " + unit.name() + " with " + diagnostics.all().size() + " diagnostic(s)");
			return new CompilationResult(text, true, printer.imports().synthesized(), diagnostics);
		} catch (CompilationAbortedException e) {
			LOG.info("aborted " + unit.name() + ": " + e.diagnostic().message());
			return CompilationResult.aborted(diagnostics);
		} catch (StructuralViolationException e) {
			diagnostics.fatal("internal error: " + e.getMessage(), e.span(), unit.name());
			return CompilationResult.aborted(diagnostics);
		} finally {
			for (Directive d : attached) {
				unit.graph().detach(d);
			}
		}
	}
}
