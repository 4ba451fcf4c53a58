package tessera.parse.directive;

public enum DirectiveTokenType {
	SENTINEL,
	WORD,
	// text between balanced parentheses, parentheses excluded
	ARGUMENTS,
	COMMA,
	EOF
}
