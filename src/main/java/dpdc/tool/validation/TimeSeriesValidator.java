package dpdc.tool.validation;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threeten.extra.Interval;

import dpdc.tool.domain.DuplicateKey;
import dpdc.tool.domain.TimeSeriesValidationReport;
import dpdc.tool.support.Timestamps;

/**
 * Check the temporal integrity of a keyed record stream.
 *
 * <p>
 * The validator works on the raw key stream of a table file, before any
 * de-duplication, so that repeated keys can be detected. Keys are compared by
 * the instant they denote.
 * </p>
 */
public class TimeSeriesValidator {

	private static final Logger log = LoggerFactory.getLogger(TimeSeriesValidator.class);

	private final Duration gridStep;
	private final ZoneOffset defaultOffset;
	private final boolean alignToMidnight;

	/**
	 * Constructor.
	 *
	 * @param gridStep        the expected spacing between keys
	 * @param defaultOffset   the offset for keys that do not declare one
	 * @param alignToMidnight {@code true} to anchor the grid at local midnight,
	 *                        {@code false} to anchor it at the range start
	 */
	public TimeSeriesValidator(Duration gridStep, ZoneOffset defaultOffset, boolean alignToMidnight) {
		super();
		this.gridStep = Timestamps.requireGridStep(gridStep);
		this.defaultOffset = defaultOffset;
		this.alignToMidnight = alignToMidnight;
	}

	/**
	 * Validate keys against the range they span.
	 *
	 * @param keys the raw keys, in row order
	 * @return the report
	 */
	public TimeSeriesValidationReport validate(List<String> keys) {
		return validate(keys, null, null);
	}

	/**
	 * Validate keys.
	 *
	 * @param keys  the raw keys, in row order
	 * @param start the first expected key, or {@code null} to use the earliest key
	 * @param end   the last expected key (inclusive), or {@code null} to use the
	 *              latest key
	 * @return the report
	 * @throws IllegalArgumentException if {@code start} is after {@code end},
	 *                                  or a single given bound leaves no range
	 *                                  before or after the data
	 */
	public TimeSeriesValidationReport validate(List<String> keys, OffsetDateTime start, OffsetDateTime end) {
		if (start != null && end != null && start.isAfter(end)) {
			throw new IllegalArgumentException("The start %s must not be after end %s".formatted(start, end));
		}
		if (keys == null || keys.isEmpty()) {
			return TimeSeriesValidationReport.empty(gridStep);
		}

		// instant -> occurrences
		final NavigableMap<Instant, Occurrences> actual = new TreeMap<>();
		final List<String> unparseable = new ArrayList<>();
		for (int i = 0, len = keys.size(); i < len; i++) {
			final String key = keys.get(i);
			final OffsetDateTime ts;
			try {
				ts = Timestamps.parseKey(key, defaultOffset);
			} catch (DateTimeParseException e) {
				unparseable.add(key);
				continue;
			}
			actual.computeIfAbsent(ts.toInstant(), k -> new Occurrences(ts)).rows.add(i);
		}

		final List<DuplicateKey> duplicates = new ArrayList<>();
		for (Occurrences o : actual.values()) {
			if (o.rows.size() > 1) {
				duplicates.add(new DuplicateKey(Timestamps.key(o.first), List.copyOf(o.rows)));
			}
		}

		if (actual.isEmpty()) {
			return new TimeSeriesValidationReport(gridStep, null, keys.size(), 0L, duplicates, null, null, null,
					unparseable);
		}

		final OffsetDateTime rangeStart = (start != null ? start : actual.firstEntry().getValue().first);
		final OffsetDateTime rangeEnd = (end != null ? end : actual.lastEntry().getValue().first);
		if (rangeStart.isAfter(rangeEnd)) {
			throw new IllegalArgumentException(
					"The range start %s is after the range end %s".formatted(Timestamps.key(rangeStart),
							Timestamps.key(rangeEnd)));
		}
		final OffsetDateTime gridStart = (alignToMidnight ? Timestamps.alignCeiling(rangeStart, gridStep)
				: rangeStart);

		final List<String> missing = new ArrayList<>();
		long expectedCount = 0L;
		for (OffsetDateTime t = gridStart; !t.isAfter(rangeEnd); t = t.plus(gridStep)) {
			expectedCount++;
			if (!actual.containsKey(t.toInstant())) {
				missing.add(Timestamps.key(t));
			}
		}

		final List<String> extra = new ArrayList<>();
		final List<String> outOfRange = new ArrayList<>();
		final long stepNanos = gridStep.toNanos();
		for (Entry<Instant, Occurrences> e : actual.entrySet()) {
			final Instant t = e.getKey();
			if (t.isBefore(rangeStart.toInstant()) || t.isAfter(rangeEnd.toInstant())) {
				outOfRange.add(Timestamps.key(e.getValue().first));
			} else if (t.isBefore(gridStart.toInstant())
					|| Duration.between(gridStart.toInstant(), t).toNanos() % stepNanos != 0L) {
				extra.add(Timestamps.key(e.getValue().first));
			}
		}

		final Interval range = Interval.of(rangeStart.toInstant(), rangeEnd.toInstant());
		final TimeSeriesValidationReport report = new TimeSeriesValidationReport(gridStep, range, keys.size(),
				expectedCount, duplicates, missing, extra, outOfRange, unparseable);
		log.info("Validated {} rows from {} to {}: {} duplicates, {} missing, {} extra, {} out of range",
				report.totalRows(), Timestamps.key(rangeStart), Timestamps.key(rangeEnd), report.duplicateCount(),
				report.missingCount(), report.extraCount(), report.outOfRangeCount());
		return report;
	}

	private static final class Occurrences {

		private final OffsetDateTime first;
		private final List<Integer> rows = new ArrayList<>(1);

		private Occurrences(OffsetDateTime first) {
			super();
			this.first = first;
		}

	}

}
