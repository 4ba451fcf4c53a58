package tessera.print;

/**
 * A synthesized import. {@code name} is null for a whole-module import (a C
 * header); {@code alias} is null when the name is used unchanged.
 */
public record ImportEntry(String source, String name, String alias) {
	public String localName() {
		return alias == null ? name : alias;
	}
}
