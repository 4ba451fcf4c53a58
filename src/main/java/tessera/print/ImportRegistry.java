package tessera.print;

import org.apache.log4j.Logger;
import tessera.ast.decl.ImportTarget;
import tessera.scope.ScopeManager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Imports of one compilation unit: those written in the source and those the
 * printer needs in addition.
 *
 * Registering a (source, symbol) pair a second time returns the name chosen
 * the first time and adds nothing.
 */
public final class ImportRegistry {
	private static final Logger LOG = Logger.getLogger(ImportRegistry.class);

	private final NameSwaps swaps;
	private final ScopeManager scopes;
	// source + '\0' + canonical name -> local name
	private final Map<String, String> known = new HashMap<>();
	private final Set<String> modules = new HashSet<>();
	private final List<ImportEntry> synthesized = new ArrayList<>();

	public ImportRegistry(NameSwaps swaps, ScopeManager scopes) {
		this.swaps = swaps;
		this.scopes = scopes;
	}

	public NameSwaps swaps() {
		return swaps;
	}

	/**
	 * Local name to use for {@code canonical} from {@code source}, synthesizing
	 * an import the first time. The name is aliased when the target's own name
	 * is reserved or already bound in the visible scopes.
	 */
	public String register(String source, String canonical) {
		String key = key(source, canonical);
		String local = known.get(key);
		if (local != null) {
			return local;
		}
		String external = swaps.target(source, canonical);
		String alias = null;
		if (scopes.isReserved(external) || scopes.lookup(external) != null) {
			alias = scopes.freshGlobalName(external);
		}
		ImportEntry entry = new ImportEntry(swaps.source(source), external, alias);
		synthesized.add(entry);
		known.put(key, entry.localName());
		LOG.debug("synthesized import " + entry);
		return entry.localName();
	}

	/** Whole-module import, such as a C header. */
	public void include(String source) {
		if (modules.add(source)) {
			synthesized.add(new ImportEntry(source, null, null));
			LOG.debug("synthesized include " + source);
		}
	}

	/**
	 * Teaches the registry an import written in the source, so that later
	 * references use its local name. Returns the external name to print.
	 */
	public String recordExisting(String source, ImportTarget target) {
		String external = swaps.target(source, target.name());
		String local = target.alias() == null ? external : target.alias();
		known.putIfAbsent(key(source, target.name()), local);
		return external;
	}

	public void recordModule(String source) {
		modules.add(source);
	}

	public List<ImportEntry> synthesized() {
		return Collections.unmodifiableList(synthesized);
	}

	private static String key(String source, String canonical) {
		return source + '\0' + canonical;
	}
}
