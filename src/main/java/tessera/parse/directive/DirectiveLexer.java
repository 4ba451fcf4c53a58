package tessera.parse.directive;

import tessera.ast.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for one directive comment line.
 *
 * Notes:
 * - Skips whitespace.
 * - A parenthesised group is a single ARGUMENTS token holding the inner text
 * verbatim; nested parentheses are kept inside it.
 */
public final class DirectiveLexer {
	private final String sentinel;

	public DirectiveLexer(String sentinel) {
		this.sentinel = sentinel;
	}

	public List<DirectiveToken> lex(String input, int line) {
		List<DirectiveToken> tokens = new ArrayList<>();
		int i = 0;
		while (i < input.length()) {
			char c = input.charAt(i);

			if (Character.isWhitespace(c)) {
				i++;
				continue;
			}

			if (input.startsWith(sentinel, i)) {
				int start = i;
				i += sentinel.length();
				tokens.add(new DirectiveToken(DirectiveTokenType.SENTINEL, sentinel, new SourceSpan(line, start, i)));
				continue;
			}

			// identifier: letter or underscore, then letters/digits/underscores
			if (Character.isLetter(c) || c == '_') {
				int start = i;
				i++;
				while (i < input.length()) {
					char ch = input.charAt(i);
					if (Character.isLetterOrDigit(ch) || ch == '_') {
						i++;
					} else {
						break;
					}
				}
				tokens.add(new DirectiveToken(DirectiveTokenType.WORD, input.substring(start, i),
						new SourceSpan(line, start, i)));
				continue;
			}

			if (c == '(') {
				int start = i;
				i = consumeGroup(input, i, line);
				tokens.add(new DirectiveToken(DirectiveTokenType.ARGUMENTS, input.substring(start + 1, i - 1),
						new SourceSpan(line, start, i)));
				continue;
			}

			if (c == ',') {
				tokens.add(new DirectiveToken(DirectiveTokenType.COMMA, ",", new SourceSpan(line, i, i + 1)));
				i++;
				continue;
			}

			throw new DirectiveSyntaxException("unexpected character '" + c + "' at column " + (i + 1), line, input);
		}

		tokens.add(new DirectiveToken(DirectiveTokenType.EOF, "", new SourceSpan(line, input.length(), input.length())));
		return tokens;
	}

	private static int consumeGroup(String input, int start, int line) {
		int depth = 0;
		int i = start;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '(') {
				depth++;
			} else if (c == ')') {
				depth--;
				if (depth == 0) {
					return i + 1;
				}
			}
			i++;
		}
		throw new DirectiveSyntaxException("unbalanced parenthesis at column " + (start + 1), line, input);
	}
}
