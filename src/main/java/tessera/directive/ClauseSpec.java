package tessera.directive;

import java.util.List;

/**
 * A clause legal under some version. When {@code values} is not empty the
 * first argument must be one of them.
 */
public record ClauseSpec(String name, OmpVersion since, ArgumentForm argument, boolean modifier,
		List<String> values) {
	public ClauseSpec {
		values = List.copyOf(values);
	}
}
