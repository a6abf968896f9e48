package dpdc.tool.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * The rows read from a source, with warnings for every record that was
 * skipped.
 *
 * @param rows     the parsed rows, in source order
 * @param warnings the warnings
 * @param filtered the count of records intentionally filtered out (for example
 *                 timestamps not aligned to the grid)
 */
public record SourceReadResult(List<KeyedRow> rows, List<String> warnings, int filtered) {

	/**
	 * Constructor.
	 *
	 * @param rows     the parsed rows
	 * @param warnings the warnings
	 * @param filtered the filtered count
	 */
	public SourceReadResult {
		rows = (rows != null ? List.copyOf(rows) : List.of());
		warnings = (warnings != null ? List.copyOf(warnings) : List.of());
	}

	/**
	 * Create a result for a source that could not be read at all.
	 *
	 * @param warning the warning
	 * @return the result
	 */
	public static SourceReadResult failed(String warning) {
		return new SourceReadResult(List.of(), List.of(warning), 0);
	}

	/**
	 * Aggregate per-record results.
	 *
	 * @param source   a source name to prefix warnings with
	 * @param results  the record results
	 * @param filtered the filtered record count
	 * @return the result
	 */
	public static SourceReadResult of(String source, List<RecordResult> results, int filtered) {
		var rows = new ArrayList<KeyedRow>(results.size());
		var warnings = new ArrayList<String>(4);
		for (RecordResult r : results) {
			if (r.isParsed()) {
				rows.add(r.row());
			} else {
				warnings.add("%s: %s".formatted(source, r.reason()));
			}
		}
		return new SourceReadResult(rows, warnings, filtered);
	}

}
