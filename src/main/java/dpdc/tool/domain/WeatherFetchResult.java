package dpdc.tool.domain;

import java.util.List;

/**
 * The result of fetching weather observations.
 *
 * @param table    the observations, ordered by key
 * @param warnings non-fatal warnings raised while fetching
 * @param requests the number of date range requests made, including retries
 */
public record WeatherFetchResult(Table table, List<String> warnings, int requests) {

	/**
	 * Constructor.
	 *
	 * @param table    the table
	 * @param warnings the warnings
	 * @param requests the request count
	 */
	public WeatherFetchResult {
		warnings = (warnings != null ? List.copyOf(warnings) : List.of());
	}

}
