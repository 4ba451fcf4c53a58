package tessera.print;

import tessera.types.ElementKind;
import tessera.types.Precision;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-target constructor names for each element kind and width. A default
 * precision maps to the target's plain type, never to a width-suffixed name.
 */
public final class CastTable {
	/** Constructor or type name, and the module providing it (null for builtins). */
	public record Entry(String name, String module) {
	}

	private final Map<ElementKind, Entry> defaults = new EnumMap<>(ElementKind.class);
	private final Map<ElementKind, Map<Integer, Entry>> sized = new EnumMap<>(ElementKind.class);

	private CastTable() {
	}

	private CastTable plain(ElementKind kind, String name, String module) {
		defaults.put(kind, new Entry(name, module));
		return this;
	}

	private CastTable width(ElementKind kind, int bits, String name, String module) {
		sized.computeIfAbsent(kind, k -> new HashMap<>()).put(bits, new Entry(name, module));
		return this;
	}

	/** Entry for the kind and precision, or null if the target has none. */
	public Entry lookup(ElementKind kind, Precision precision) {
		if (precision.isDefault()) {
			return defaults.get(kind);
		}
		Map<Integer, Entry> byWidth = sized.get(kind);
		return byWidth == null ? null : byWidth.get(precision.bits());
	}

	public static CastTable python() {
		return new CastTable()
				.plain(ElementKind.BOOL, "bool", null)
				.plain(ElementKind.INTEGER, "int", null)
				.plain(ElementKind.FLOAT, "float", null)
				.plain(ElementKind.COMPLEX, "complex", null)
				.plain(ElementKind.STRING, "str", null)
				.width(ElementKind.BOOL, 8, "bool", null)
				.width(ElementKind.INTEGER, 8, "int8", "numpy")
				.width(ElementKind.INTEGER, 16, "int16", "numpy")
				.width(ElementKind.INTEGER, 32, "int32", "numpy")
				.width(ElementKind.INTEGER, 64, "int64", "numpy")
				.width(ElementKind.FLOAT, 32, "float32", "numpy")
				.width(ElementKind.FLOAT, 64, "float", null)
				.width(ElementKind.COMPLEX, 64, "complex64", "numpy")
				.width(ElementKind.COMPLEX, 128, "complex", null);
	}

	public static CastTable c() {
		return new CastTable()
				.plain(ElementKind.BOOL, "bool", "<stdbool.h>")
				.plain(ElementKind.INTEGER, "int64_t", "<stdint.h>")
				.plain(ElementKind.FLOAT, "double", null)
				.plain(ElementKind.COMPLEX, "double complex", "<complex.h>")
				.plain(ElementKind.STRING, "char*", null)
				.plain(ElementKind.VOID, "void", null)
				.width(ElementKind.BOOL, 8, "bool", "<stdbool.h>")
				.width(ElementKind.INTEGER, 8, "int8_t", "<stdint.h>")
				.width(ElementKind.INTEGER, 16, "int16_t", "<stdint.h>")
				.width(ElementKind.INTEGER, 32, "int32_t", "<stdint.h>")
				.width(ElementKind.INTEGER, 64, "int64_t", "<stdint.h>")
				.width(ElementKind.FLOAT, 32, "float", null)
				.width(ElementKind.FLOAT, 64, "double", null)
				.width(ElementKind.COMPLEX, 64, "float complex", "<complex.h>")
				.width(ElementKind.COMPLEX, 128, "double complex", "<complex.h>");
	}

	/** ndarray element tags used by the C runtime. */
	public static CastTable cArrayTags() {
		return new CastTable()
				.plain(ElementKind.BOOL, "nd_bool", null)
				.plain(ElementKind.INTEGER, "nd_int64", null)
				.plain(ElementKind.FLOAT, "nd_double", null)
				.plain(ElementKind.COMPLEX, "nd_cdouble", null)
				.width(ElementKind.BOOL, 8, "nd_bool", null)
				.width(ElementKind.INTEGER, 8, "nd_int8", null)
				.width(ElementKind.INTEGER, 16, "nd_int16", null)
				.width(ElementKind.INTEGER, 32, "nd_int32", null)
				.width(ElementKind.INTEGER, 64, "nd_int64", null)
				.width(ElementKind.FLOAT, 32, "nd_float", null)
				.width(ElementKind.FLOAT, 64, "nd_double", null)
				.width(ElementKind.COMPLEX, 64, "nd_cfloat", null)
				.width(ElementKind.COMPLEX, 128, "nd_cdouble", null);
	}
}
