package tessera;

import tessera.directive.OmpVersion;
import tessera.print.Target;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings of a {@link Transpiler}. Missing keys fall back to the defaults:
 * target {@code python}, directive version {@code 4.5}, indent width 4.
 */
public final class TranspilerConfig {
	public static final String RESOURCE = "/tessera.properties";

	private final Target target;
	private final OmpVersion openmpVersion;
	private final int indentWidth;

	public TranspilerConfig(Properties properties) {
		this.target = Target.of(properties.getProperty("target", "python").trim());
		this.openmpVersion = OmpVersion.of(properties.getProperty("openmp.version", "4.5").trim());
		this.indentWidth = parseWidth(properties.getProperty("indent.width", "4").trim());
	}

	public static TranspilerConfig defaults() {
		return new TranspilerConfig(new Properties());
	}

	/** Reads {@code tessera.properties} from the classpath; defaults when it is absent. */
	public static TranspilerConfig load() throws IOException {
		Properties properties = new Properties();
		try (InputStream in = TranspilerConfig.class.getResourceAsStream(RESOURCE)) {
			if (in != null) {
				properties.load(in);
			}
		}
		return new TranspilerConfig(properties);
	}

	private static int parseWidth(String value) {
		int width;
		try {
			width = Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("indent.width must be a number: " + value, e);
		}
		if (width < 1) {
			throw new IllegalArgumentException("indent.width must be positive: " + value);
		}
		return width;
	}

	public Target target() {
		return target;
	}

	public OmpVersion openmpVersion() {
		return openmpVersion;
	}

	public int indentWidth() {
		return indentWidth;
	}

	@Override
	public String toString() {
		return "TranspilerConfig(target=" + target.label() + ", openmp=" + openmpVersion + ", indent=" + indentWidth
				+ ")";
	}
}
