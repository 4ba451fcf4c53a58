package tessera.directive;

import java.util.List;

/**
 * Raw form of the directive grammar file, bound by Jackson.
 */
public final class GrammarModel {
	public String sentinel;
	public String prefix;
	public List<String> versions;
	public List<ClauseEntry> clauses;
	public List<ConstructEntry> constructs;

	public static final class ClauseEntry {
		public String name;
		public String since;
		public String argument;
		public boolean modifier;
		public List<String> values;
	}

	public static final class ConstructEntry {
		public String name;
		public String since;
		public boolean loop;
		public boolean block;
		public String argument;
		public List<String> clauses;
		public List<String> endClauses;
		public List<CombinedEntry> combined;
	}

	public static final class CombinedEntry {
		public String with;
		public String since;
	}
}
