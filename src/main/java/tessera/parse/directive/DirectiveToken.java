package tessera.parse.directive;

import tessera.ast.SourceSpan;

public record DirectiveToken(DirectiveTokenType type, String lexeme, SourceSpan span) {
}
