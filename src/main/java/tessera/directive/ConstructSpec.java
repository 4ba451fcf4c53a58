package tessera.directive;

import java.util.Map;
import java.util.Set;

/**
 * A directive construct under one version. {@code combined} maps the suffixes
 * the construct may be combined with (as in {@code parallel for}) to the
 * version introducing that form.
 */
public record ConstructSpec(String name, OmpVersion since, boolean loop, boolean block, ArgumentForm argument,
		Set<String> clauses, Set<String> endClauses, Map<String, OmpVersion> combined) {
	public ConstructSpec {
		clauses = Set.copyOf(clauses);
		endClauses = Set.copyOf(endClauses);
		combined = Map.copyOf(combined);
	}

	public boolean allows(String clause, boolean end) {
		return end ? endClauses.contains(clause) : clauses.contains(clause);
	}
}
