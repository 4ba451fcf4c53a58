package tessera.directive;

import tessera.ast.Node;
import tessera.ast.NodeGraph;
import tessera.ast.SourceSpan;
import tessera.ast.stmt.Directive;
import tessera.diag.Diagnostics;
import tessera.parse.directive.DirectiveParser;
import tessera.parse.directive.DirectiveSyntaxException;

/**
 * Turns directive comment text into a validated {@link Directive} attached to
 * the node it annotates.
 */
public final class DirectiveProcessor {
	private final NodeGraph graph;
	private final Diagnostics diagnostics;
	private final DirectiveParser parser;
	private final DirectiveValidator validator;

	public DirectiveProcessor(ClauseSchema schema, NodeGraph graph, Diagnostics diagnostics) {
		this.graph = graph;
		this.diagnostics = diagnostics;
		this.parser = new DirectiveParser(schema);
		this.validator = new DirectiveValidator(graph, diagnostics);
	}

	public Directive process(String text, int line, Node target) {
		DirectiveComment comment;
		try {
			comment = parser.parse(text, line);
		} catch (DirectiveSyntaxException e) {
			throw diagnostics.fatal("invalid directive: " + e.getMessage(), SourceSpan.ofLine(e.line()), e.text());
		}
		Directive directive = new Directive(comment, SourceSpan.ofLine(line));
		validator.validate(directive, target);
		graph.attach(directive, target);
		return directive;
	}
}
