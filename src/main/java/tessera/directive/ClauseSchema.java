package tessera.directive;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The constructs and clauses legal under one {@link OmpVersion}.
 */
public final class ClauseSchema {
	private final OmpVersion version;
	private final String sentinel;
	private final String prefix;
	private final Map<String, ConstructSpec> constructs;
	private final Map<String, ClauseSpec> clauses;
	// every clause of the grammar, for messages about clauses from a later version
	private final Map<String, OmpVersion> introduced;
	private final int longestConstruct;

	ClauseSchema(OmpVersion version, String sentinel, String prefix, Map<String, ConstructSpec> constructs,
			Map<String, ClauseSpec> clauses, Map<String, OmpVersion> introduced) {
		this.version = version;
		this.sentinel = sentinel;
		this.prefix = prefix;
		this.constructs = Collections.unmodifiableMap(new LinkedHashMap<>(constructs));
		this.clauses = Collections.unmodifiableMap(new LinkedHashMap<>(clauses));
		this.introduced = Map.copyOf(introduced);
		int longest = 1;
		for (String name : constructs.keySet()) {
			longest = Math.max(longest, words(name).size());
		}
		this.longestConstruct = longest;
	}

	public OmpVersion version() {
		return version;
	}

	public String sentinel() {
		return sentinel;
	}

	public String prefix() {
		return prefix;
	}

	/** Construct legal under this version, or null. */
	public ConstructSpec construct(String name) {
		return constructs.get(name);
	}

	/** Clause legal under this version, or null. */
	public ClauseSpec clause(String name) {
		return clauses.get(name);
	}

	/** Version introducing {@code clause}, or null if no version knows it. */
	public OmpVersion introducedIn(String clause) {
		return introduced.get(clause);
	}

	public Map<String, ConstructSpec> constructs() {
		return constructs;
	}

	/** Number of words in the longest construct name. */
	public int longestConstruct() {
		return longestConstruct;
	}

	/**
	 * Spec of {@code base} combined with {@code suffix}: the union of the
	 * clauses of every construct involved, loop-associated if any of them is.
	 * Returns null when the combination is not legal under this version.
	 */
	public ConstructSpec combine(ConstructSpec base, String suffix) {
		OmpVersion since = base.combined().get(suffix);
		if (since == null || !version.isAtLeast(since)) {
			return null;
		}
		boolean loop = base.loop();
		boolean block = base.block();
		Set<String> allowed = new HashSet<>(base.clauses());
		Set<String> endAllowed = new HashSet<>(base.endClauses());
		for (String part : splitConstructs(suffix)) {
			ConstructSpec spec = constructs.get(part);
			if (spec == null) {
				return null;
			}
			loop |= spec.loop();
			block |= spec.block();
			allowed.addAll(spec.clauses());
			endAllowed.addAll(spec.endClauses());
		}
		return new ConstructSpec(base.name() + " " + suffix, since, loop, block, ArgumentForm.NONE, allowed,
				endAllowed, Map.of());
	}

	/** Splits a run of words into construct names, longest match first. */
	List<String> splitConstructs(String text) {
		List<String> parts = new ArrayList<>();
		List<String> ws = words(text);
		int i = 0;
		while (i < ws.size()) {
			int matched = 0;
			for (int n = Math.min(longestConstruct, ws.size() - i); n > 0; n--) {
				String candidate = String.join(" ", ws.subList(i, i + n));
				if (constructs.containsKey(candidate)) {
					parts.add(candidate);
					matched = n;
					break;
				}
			}
			if (matched == 0) {
				parts.add(ws.get(i));
				matched = 1;
			}
			i += matched;
		}
		return parts;
	}

	private static List<String> words(String text) {
		return Arrays.asList(text.trim().split("\\s+"));
	}
}
