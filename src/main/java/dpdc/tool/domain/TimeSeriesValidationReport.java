package dpdc.tool.domain;

import java.time.Duration;
import java.util.List;

import org.threeten.extra.Interval;

/**
 * A time series integrity report.
 * 
 * @param gridStep      the expected spacing between keys
 * @param range         the range the expected grid covers (inclusive of its
 *                      end), or {@code null} if there were no valid keys
 * @param totalRows     the number of rows examined
 * @param expectedCount the number of keys in the expected grid
 * @param duplicates    keys occurring more than once, sorted
 * @param missing       grid keys with no data, sorted
 * @param extra         keys present but not on the grid, sorted
 * @param outOfRange    keys outside {@code range}, sorted
 * @param unparseable   keys that are not valid timestamps, in row order
 */
public record TimeSeriesValidationReport(Duration gridStep, Interval range, int totalRows, long expectedCount,
		List<DuplicateKey> duplicates, List<String> missing, List<String> extra, List<String> outOfRange,
		List<String> unparseable) {

	/**
	 * Constructor.
	 * 
	 * @param gridStep      the grid step
	 * @param range         the range
	 * @param totalRows     the total rows
	 * @param expectedCount the expected count
	 * @param duplicates    the duplicates
	 * @param missing       the missing keys
	 * @param extra         the extra keys
	 * @param outOfRange    the out of range keys
	 * @param unparseable   the unparseable keys
	 */
	public TimeSeriesValidationReport {
		duplicates = (duplicates != null ? List.copyOf(duplicates) : List.of());
		missing = (missing != null ? List.copyOf(missing) : List.of());
		extra = (extra != null ? List.copyOf(extra) : List.of());
		outOfRange = (outOfRange != null ? List.copyOf(outOfRange) : List.of());
		unparseable = (unparseable != null ? List.copyOf(unparseable) : List.of());
	}

	/**
	 * Create a report for an input with no rows.
	 * 
	 * @param gridStep the grid step
	 * @return the report
	 */
	public static TimeSeriesValidationReport empty(Duration gridStep) {
		return new TimeSeriesValidationReport(gridStep, null, 0, 0L, null, null, null, null, null);
	}

	/**
	 * Get the number of distinct duplicated keys.
	 * 
	 * @return the duplicate key count
	 */
	public int duplicateCount() {
		return duplicates.size();
	}

	/**
	 * Get the total number of rows involved in duplicates.
	 * 
	 * @return the duplicate occurrence count
	 */
	public int duplicateOccurrences() {
		return duplicates.stream().mapToInt(DuplicateKey::occurrences).sum();
	}

	/**
	 * Get the number of missing grid keys.
	 * 
	 * @return the missing count
	 */
	public int missingCount() {
		return missing.size();
	}

	/**
	 * Get the number of off-grid keys.
	 * 
	 * @return the extra count
	 */
	public int extraCount() {
		return extra.size();
	}

	/**
	 * Get the number of out-of-range keys.
	 * 
	 * @return the out of range count
	 */
	public int outOfRangeCount() {
		return outOfRange.size();
	}

	/**
	 * Test if at least one key could be parsed, or there were no keys at all.
	 * 
	 * @return {@code true} if the keys are empty or not all unparseable
	 */
	public boolean hasValidKeys() {
		return totalRows < 1 || unparseable.size() < totalRows;
	}

	/**
	 * Test if the time series passed validation.
	 * 
	 * <p>
	 * Off-grid, out-of-range and unparseable keys are reported but do not fail
	 * validation, unless no key at all could be parsed.
	 * </p>
	 * 
	 * @return {@code true} if there are valid keys and no duplicate or missing
	 *         keys
	 */
	public boolean passed() {
		return hasValidKeys() && duplicates.isEmpty() && missing.isEmpty();
	}

}
