package dpdc.tool.domain;

/**
 * The outcome of reading a single source record: either a parsed row or a
 * reason the record was skipped.
 *
 * @param row    the parsed row, or {@code null} if skipped
 * @param reason the skip reason, or {@code null} if parsed
 */
public record RecordResult(KeyedRow row, String reason) {

	/**
	 * Create a parsed result.
	 *
	 * @param row the row
	 * @return the result
	 */
	public static RecordResult parsed(KeyedRow row) {
		return new RecordResult(row, null);
	}

	/**
	 * Create a skipped result.
	 *
	 * @param reason the reason the record was skipped
	 * @return the result
	 */
	public static RecordResult skipped(String reason) {
		return new RecordResult(null, reason);
	}

	/**
	 * Test if the record was parsed.
	 *
	 * @return {@code true} if a row is available
	 */
	public boolean isParsed() {
		return row != null;
	}

}
