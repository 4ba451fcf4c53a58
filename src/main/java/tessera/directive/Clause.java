package tessera.directive;

import java.util.List;

/**
 * One parsed clause. {@code rawArguments} is the text between the parentheses
 * exactly as written, or null when the clause has none; {@code arguments} is
 * that text split at top-level commas after the modifier, if any.
 */
public record Clause(String name, String rawArguments, String modifier, List<String> arguments) {
	public Clause {
		arguments = List.copyOf(arguments);
	}

	public String text() {
		return rawArguments == null ? name : name + "(" + rawArguments + ")";
	}
}
