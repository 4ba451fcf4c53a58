package tessera.parse.directive;

import tessera.directive.ArgumentForm;
import tessera.directive.Clause;
import tessera.directive.ClauseSchema;
import tessera.directive.ClauseSpec;
import tessera.directive.ConstructSpec;
import tessera.directive.DirectiveComment;
import tessera.directive.OmpVersion;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses one directive comment against the schema of the active version.
 *
 * Strict: anything the schema does not accept, including a clause introduced
 * by a later version, throws {@link DirectiveSyntaxException}.
 */
public final class DirectiveParser {
	private final ClauseSchema schema;

	public DirectiveParser(ClauseSchema schema) {
		this.schema = schema;
	}

	public DirectiveComment parse(String text, int line) {
		List<DirectiveToken> tokens = new DirectiveLexer(schema.sentinel()).lex(text, line);
		Cursor c = new Cursor(tokens, text, line);

		c.expect(DirectiveTokenType.SENTINEL, "'" + schema.sentinel() + "'");
		c.expectWord(schema.prefix());

		boolean end = false;
		if (c.peekIsWord("end")) {
			c.next();
			end = true;
		}

		String construct = parseConstruct(c);
		ConstructSpec spec = schema.construct(construct);
		String combined = parseCombined(c, spec);
		if (combined != null) {
			spec = schema.combine(spec, combined);
		}

		String argument = null;
		if (c.peek().type() == DirectiveTokenType.ARGUMENTS) {
			argument = c.next().lexeme();
		}
		if (!end && !spec.argument().accepts(argument != null)) {
			throw c.error("construct '" + spec.name() + "' " + describe(spec.argument()));
		}
		if (end && argument != null && spec.argument() == ArgumentForm.NONE) {
			throw c.error("end directive of '" + spec.name() + "' takes no argument");
		}

		List<Clause> clauses = new ArrayList<>();
		while (!c.isAtEnd()) {
			if (c.peek().type() == DirectiveTokenType.COMMA) {
				c.next();
				continue;
			}
			clauses.add(parseClause(c, spec, end));
		}

		return new DirectiveComment(schema.version(), end, construct, combined, spec, argument, clauses);
	}

	/** Longest run of words naming a construct. */
	private String parseConstruct(Cursor c) {
		List<String> words = c.peekWords(schema.longestConstruct());
		for (int n = words.size(); n > 0; n--) {
			String candidate = String.join(" ", words.subList(0, n));
			if (schema.construct(candidate) != null) {
				c.skip(n);
				return candidate;
			}
		}
		if (words.isEmpty()) {
			throw c.error("expected a construct but got '" + c.peek().lexeme() + "'");
		}
		throw c.error("unknown construct '" + words.get(0) + "' for OpenMP " + schema.version());
	}

	/** Longest combined suffix legal for {@code base}, or null. */
	private String parseCombined(Cursor c, ConstructSpec base) {
		if (base.combined().isEmpty()) {
			return null;
		}
		int longest = 0;
		for (String suffix : base.combined().keySet()) {
			longest = Math.max(longest, suffix.split(" ").length);
		}
		List<String> words = c.peekWords(longest);
		for (int n = words.size(); n > 0; n--) {
			String candidate = String.join(" ", words.subList(0, n));
			if (base.combined().containsKey(candidate)) {
				c.skip(n);
				return candidate;
			}
		}
		return null;
	}

	private Clause parseClause(Cursor c, ConstructSpec spec, boolean end) {
		DirectiveToken nameTok = c.expect(DirectiveTokenType.WORD, "a clause");
		String name = nameTok.lexeme();
		ClauseSpec clause = schema.clause(name);
		if (clause == null) {
			OmpVersion since = schema.introducedIn(name);
			if (since != null) {
				throw c.error("clause '" + name + "' requires OpenMP " + since + " (active: " + schema.version() + ")");
			}
			throw c.error("unknown clause '" + name + "'");
		}
		if (!spec.allows(name, end)) {
			throw c.error("clause '" + name + "' is not allowed on " + (end ? "end " : "") + "'" + spec.name() + "'");
		}

		String raw = null;
		if (c.peek().type() == DirectiveTokenType.ARGUMENTS) {
			raw = c.next().lexeme();
		}
		if (!clause.argument().accepts(raw != null)) {
			throw c.error("clause '" + name + "' " + describe(clause.argument()));
		}
		if (raw == null) {
			return new Clause(name, null, null, List.of());
		}
		if (raw.isBlank()) {
			throw c.error("clause '" + name + "' has an empty argument list");
		}

		String modifier = null;
		String rest = raw;
		int colon = clause.modifier() ? topLevelIndexOf(raw, ':') : -1;
		if (colon >= 0) {
			modifier = raw.substring(0, colon).trim();
			rest = raw.substring(colon + 1);
		}
		List<String> arguments = splitTopLevel(rest);
		if (!clause.values().isEmpty() && !clause.values().contains(arguments.get(0))) {
			throw c.error("invalid value '" + arguments.get(0) + "' for clause '" + name + "', expected one of "
					+ clause.values());
		}
		return new Clause(name, raw, modifier, arguments);
	}

	private static String describe(ArgumentForm form) {
		return form == ArgumentForm.NONE ? "takes no argument" : "requires an argument";
	}

	private static int topLevelIndexOf(String text, char target) {
		int depth = 0;
		for (int i = 0; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (ch == '(' || ch == '[') {
				depth++;
			} else if (ch == ')' || ch == ']') {
				depth--;
			} else if (ch == target && depth == 0) {
				return i;
			}
		}
		return -1;
	}

	static List<String> splitTopLevel(String text) {
		List<String> parts = new ArrayList<>();
		int depth = 0;
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (ch == '(' || ch == '[') {
				depth++;
			} else if (ch == ')' || ch == ']') {
				depth--;
			} else if (ch == ',' && depth == 0) {
				parts.add(text.substring(start, i).trim());
				start = i + 1;
			}
		}
		parts.add(text.substring(start).trim());
		return parts;
	}

	private static final class Cursor {
		private final List<DirectiveToken> tokens;
		private final String text;
		private final int line;
		private int pos;

		Cursor(List<DirectiveToken> tokens, String text, int line) {
			this.tokens = tokens;
			this.text = text;
			this.line = line;
			this.pos = 0;
		}

		boolean isAtEnd() {
			return peek().type() == DirectiveTokenType.EOF;
		}

		DirectiveToken peek() {
			return tokens.get(pos);
		}

		DirectiveToken next() {
			return tokens.get(pos++);
		}

		void skip(int n) {
			pos += n;
		}

		boolean peekIsWord(String lexeme) {
			DirectiveToken t = peek();
			return t.type() == DirectiveTokenType.WORD && t.lexeme().equals(lexeme);
		}

		/** Up to {@code max} consecutive words starting at the cursor. */
		List<String> peekWords(int max) {
			List<String> words = new ArrayList<>();
			for (int i = pos; i < tokens.size() && words.size() < max; i++) {
				DirectiveToken t = tokens.get(i);
				if (t.type() != DirectiveTokenType.WORD) {
					break;
				}
				words.add(t.lexeme());
			}
			return words;
		}

		DirectiveToken expectWord(String lexeme) {
			DirectiveToken t = expect(DirectiveTokenType.WORD, "'" + lexeme + "'");
			if (!t.lexeme().equals(lexeme)) {
				throw error("expected " + lexeme + " but got " + t.lexeme());
			}
			return t;
		}

		DirectiveToken expect(DirectiveTokenType type, String what) {
			DirectiveToken t = next();
			if (t.type() != type) {
				throw error("expected " + what + " but got " + t.type() + "(" + t.lexeme() + ")");
			}
			return t;
		}

		DirectiveSyntaxException error(String message) {
			return new DirectiveSyntaxException(message, line, text);
		}
	}
}
