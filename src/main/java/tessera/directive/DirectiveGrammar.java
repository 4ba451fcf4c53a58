package tessera.directive;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The versioned directive grammar, read once from its data file and validated
 * into one {@link ClauseSchema} per version.
 */
public final class DirectiveGrammar {
	private static final Logger LOG = Logger.getLogger(DirectiveGrammar.class);
	public static final String RESOURCE = "/tessera/directive/openmp-grammar.json";

	private static final ObjectMapper MAPPER = new ObjectMapper()
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

	private final Map<OmpVersion, ClauseSchema> schemas;

	private DirectiveGrammar(Map<OmpVersion, ClauseSchema> schemas) {
		this.schemas = schemas;
	}

	/** The bundled grammar; loaded on first use. */
	public static DirectiveGrammar standard() {
		return Holder.INSTANCE;
	}

	public static DirectiveGrammar load(InputStream in) throws IOException {
		GrammarModel model = MAPPER.readValue(in, GrammarModel.class);
		return build(model);
	}

	public ClauseSchema schema(OmpVersion version) {
		ClauseSchema schema = schemas.get(version);
		if (schema == null) {
			throw new IllegalArgumentException("grammar has no schema for OpenMP " + version);
		}
		return schema;
	}

	static DirectiveGrammar build(GrammarModel model) {
		require(model.sentinel != null && !model.sentinel.isEmpty(), "missing sentinel");
		require(model.prefix != null && !model.prefix.isEmpty(), "missing prefix");
		require(model.versions != null && !model.versions.isEmpty(), "no versions declared");
		require(model.clauses != null && model.constructs != null, "missing clause or construct list");

		Map<String, ClauseSpec> allClauses = new LinkedHashMap<>();
		for (GrammarModel.ClauseEntry e : model.clauses) {
			require(e.name != null, "clause without a name");
			require(!allClauses.containsKey(e.name), "duplicate clause '" + e.name + "'");
			allClauses.put(e.name, new ClauseSpec(e.name, version(model, e.since, e.name), ArgumentForm.of(e.argument),
					e.modifier, e.values == null ? List.of() : e.values));
		}
		Map<String, ConstructSpec> allConstructs = new LinkedHashMap<>();
		for (GrammarModel.ConstructEntry e : model.constructs) {
			require(e.name != null, "construct without a name");
			require(!allConstructs.containsKey(e.name), "duplicate construct '" + e.name + "'");
			Set<String> clauses = Set.copyOf(e.clauses == null ? List.of() : e.clauses);
			Set<String> endClauses = Set.copyOf(e.endClauses == null ? List.of() : e.endClauses);
			for (String c : clauses) {
				require(allClauses.containsKey(c), "construct '" + e.name + "' names unknown clause '" + c + "'");
			}
			for (String c : endClauses) {
				require(allClauses.containsKey(c), "construct '" + e.name + "' names unknown end clause '" + c + "'");
			}
			Map<String, OmpVersion> combined = new LinkedHashMap<>();
			if (e.combined != null) {
				for (GrammarModel.CombinedEntry c : e.combined) {
					combined.put(c.with, version(model, c.since, e.name + " " + c.with));
				}
			}
			allConstructs.put(e.name, new ConstructSpec(e.name, version(model, e.since, e.name), e.loop, e.block,
					ArgumentForm.of(e.argument), clauses, endClauses, combined));
		}

		Map<String, OmpVersion> introduced = new HashMap<>();
		for (ClauseSpec c : allClauses.values()) {
			introduced.put(c.name(), c.since());
		}
		Map<OmpVersion, ClauseSchema> schemas = new EnumMap<>(OmpVersion.class);
		for (String label : model.versions) {
			OmpVersion v = OmpVersion.of(label);
			schemas.put(v, schemaFor(v, model, allConstructs, allClauses, introduced));
		}
		LOG.debug("loaded directive grammar for versions " + schemas.keySet());
		return new DirectiveGrammar(schemas);
	}

	private static ClauseSchema schemaFor(OmpVersion v, GrammarModel model, Map<String, ConstructSpec> allConstructs,
			Map<String, ClauseSpec> allClauses, Map<String, OmpVersion> introduced) {
		Map<String, ClauseSpec> clauses = new LinkedHashMap<>();
		for (ClauseSpec c : allClauses.values()) {
			if (v.isAtLeast(c.since())) {
				clauses.put(c.name(), c);
			}
		}
		Map<String, ConstructSpec> constructs = new LinkedHashMap<>();
		for (ConstructSpec c : allConstructs.values()) {
			if (!v.isAtLeast(c.since())) {
				continue;
			}
			Set<String> allowed = new HashSet<>(c.clauses());
			allowed.retainAll(clauses.keySet());
			Set<String> endAllowed = new HashSet<>(c.endClauses());
			endAllowed.retainAll(clauses.keySet());
			Map<String, OmpVersion> combined = new LinkedHashMap<>();
			c.combined().forEach((suffix, since) -> {
				if (v.isAtLeast(since)) {
					combined.put(suffix, since);
				}
			});
			constructs.put(c.name(), new ConstructSpec(c.name(), c.since(), c.loop(), c.block(), c.argument(), allowed,
					endAllowed, combined));
		}
		ClauseSchema schema = new ClauseSchema(v, model.sentinel, model.prefix, constructs, clauses, introduced);
		for (ConstructSpec c : constructs.values()) {
			for (String suffix : c.combined().keySet()) {
				for (String part : schema.splitConstructs(suffix)) {
					require(constructs.containsKey(part),
							"'" + c.name() + " " + suffix + "' combines '" + part + "', unknown in OpenMP " + v);
				}
			}
		}
		return schema;
	}

	private static OmpVersion version(GrammarModel model, String label, String what) {
		require(label != null, "'" + what + "' has no version");
		require(model.versions.contains(label), "'" + what + "' uses undeclared version " + label);
		return OmpVersion.of(label);
	}

	private static void require(boolean condition, String message) {
		if (!condition) {
			throw new IllegalStateException("invalid directive grammar: " + message);
		}
	}

	private static final class Holder {
		static final DirectiveGrammar INSTANCE = loadBundled();

		private static DirectiveGrammar loadBundled() {
			try (InputStream in = DirectiveGrammar.class.getResourceAsStream(RESOURCE)) {
				if (in == null) {
					throw new IllegalStateException("directive grammar resource not found: " + RESOURCE);
				}
				return load(in);
			} catch (IOException e) {
				throw new UncheckedIOException("cannot read directive grammar", e);
			}
		}
	}
}
