package dpdc.tool.support;

import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

/**
 * Map command verbosity flags to tool log levels.
 */
public final class Verbosity {

	/** The logger name of the tool packages. */
	public static final String TOOL_LOGGER = "dpdc.tool";

	private Verbosity() {
		// not available
	}

	/**
	 * Get the log level for a verbosity.
	 *
	 * @param verbosity the verbosity flags, or {@code null}
	 * @return the level, or {@code null} to leave the configured level alone
	 */
	public static LogLevel level(boolean[] verbosity) {
		if (verbosity == null || verbosity.length < 1) {
			return null;
		}
		return (verbosity.length == 1 ? LogLevel.INFO : LogLevel.DEBUG);
	}

	/**
	 * Raise the tool log level to match a verbosity.
	 *
	 * @param verbosity the verbosity flags, or {@code null}
	 */
	public static void apply(boolean[] verbosity) {
		LogLevel level = level(verbosity);
		if (level != null) {
			LoggingSystem.get(Verbosity.class.getClassLoader()).setLogLevel(TOOL_LOGGER, level);
		}
	}

}
