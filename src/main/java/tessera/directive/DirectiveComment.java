package tessera.directive;

import java.util.List;

/**
 * A directive comment parsed under one version.
 *
 * {@code construct} and {@code combined} keep the words as written, so that
 * printing reproduces the same combined form; {@code spec} is the resolved
 * construct, including the clauses a combined form allows.
 */
public record DirectiveComment(OmpVersion version, boolean end, String construct, String combined,
		ConstructSpec spec, String argument, List<Clause> clauses) {
	public DirectiveComment {
		clauses = List.copyOf(clauses);
	}

	/** {@code parallel for}, or just the construct when it is not combined. */
	public String fullConstruct() {
		return combined == null ? construct : construct + " " + combined;
	}

	/** Everything after the {@code omp} prefix, in canonical spacing. */
	public String clauseText() {
		StringBuilder sb = new StringBuilder();
		if (end) {
			sb.append("end ");
		}
		sb.append(fullConstruct());
		if (argument != null) {
			sb.append('(').append(argument).append(')');
		}
		for (Clause c : clauses) {
			sb.append(' ').append(c.text());
		}
		return sb.toString();
	}

	/** First clause with the given name, or null. */
	public Clause clause(String name) {
		for (Clause c : clauses) {
			if (c.name().equals(name)) {
				return c;
			}
		}
		return null;
	}
}
