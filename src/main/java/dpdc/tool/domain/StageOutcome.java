package dpdc.tool.domain;

import java.util.List;

/**
 * The summary of a completed stage transform.
 * 
 * @param rowCount the number of rows written, or {@code -1} if not applicable
 * @param details  informational summary lines
 * @param warnings non-fatal warnings raised while processing
 */
public record StageOutcome(long rowCount, List<String> details, List<String> warnings) {

	/**
	 * Constructor.
	 * 
	 * @param rowCount the row count
	 * @param details  the details
	 * @param warnings the warnings
	 */
	public StageOutcome {
		details = (details != null ? List.copyOf(details) : List.of());
		warnings = (warnings != null ? List.copyOf(warnings) : List.of());
	}

}
