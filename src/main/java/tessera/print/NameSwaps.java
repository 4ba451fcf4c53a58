package tessera.print;

import java.util.Map;

/**
 * Canonical library names mapped to the names a target ecosystem uses for
 * them. Applied only when imports are emitted; the tree keeps canonical names.
 */
public final class NameSwaps {
	private static final NameSwaps NONE = new NameSwaps(Map.of(), Map.of());

	private final Map<String, Map<String, String>> targets;
	private final Map<String, String> sources;

	public NameSwaps(Map<String, Map<String, String>> targets, Map<String, String> sources) {
		this.targets = Map.copyOf(targets);
		this.sources = Map.copyOf(sources);
	}

	public static NameSwaps python() {
		return new NameSwaps(
				Map.of(
						"numpy", Map.of(
								"product", "prod",
								"amax", "max",
								"amin", "min",
								"abs", "absolute"),
						"numpy.random", Map.of("rand", "random")),
				Map.of("omp_lib", "tessera.stdlib.internal.openmp"));
	}

	public static NameSwaps none() {
		return NONE;
	}

	public String source(String source) {
		return sources.getOrDefault(source, source);
	}

	public String target(String source, String canonical) {
		Map<String, String> names = targets.get(source);
		if (names == null) {
			return canonical;
		}
		return names.getOrDefault(canonical, canonical);
	}
}
