package absint;

import java.util.Properties;

/**
 * Analysis configuration.
 */
public final class AnalysisOptions {
	/** Property: upper bound on fixpoint iterations per loop. */
	public static final String MAX_ITERATIONS = "absint.maxIterations";
	/** Property: whether branch and loop conditions refine the memory. */
	public static final String REFINE = "absint.refine";
	/** Property: whether fixpoint iterates are logged. */
	public static final String TRACE = "absint.trace";

	public static final int DEFAULT_MAX_ITERATIONS = 1000;

	private final int maxIterations;
	private final boolean refine;
	private final boolean trace;

	public AnalysisOptions(int maxIterations, boolean refine, boolean trace) {
		if (maxIterations <= 0) {
			throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
		}
		this.maxIterations = maxIterations;
		this.refine = refine;
		this.trace = trace;
	}

	public static AnalysisOptions defaults() {
		return new AnalysisOptions(DEFAULT_MAX_ITERATIONS, false, true);
	}

	public static AnalysisOptions fromSystemProperties() {
		return fromProperties(System.getProperties());
	}

	public static AnalysisOptions fromProperties(Properties props) {
		return new AnalysisOptions(
				intProperty(props, MAX_ITERATIONS, DEFAULT_MAX_ITERATIONS),
				booleanProperty(props, REFINE, false),
				booleanProperty(props, TRACE, true));
	}

	/**
	 * Get an integer setting, or the default when it is unset.
	 */
	private static int intProperty(Properties props, String key, int def) {
		String value = props.getProperty(key);
		if (value == null || value.isBlank()) {
			return def;
		}
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
		}
	}

	/**
	 * Get a boolean setting, accepting only "true" and "false".
	 */
	private static boolean booleanProperty(Properties props, String key, boolean def) {
		String value = props.getProperty(key);
		if (value == null || value.isBlank()) {
			return def;
		}
		switch (value.trim().toLowerCase()) {
			case "true":
				return true;
			case "false":
				return false;
			default:
				throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
		}
	}

	public int getMaxIterations() {
		return maxIterations;
	}

	public boolean isRefine() {
		return refine;
	}

	public boolean isTrace() {
		return trace;
	}

	@Override
	public String toString() {
		return MAX_ITERATIONS + "=" + maxIterations + ", " + REFINE + "=" + refine + ", " + TRACE + "=" + trace;
	}
}
