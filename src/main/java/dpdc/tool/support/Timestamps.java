package dpdc.tool.support;

import static java.time.temporal.ChronoField.HOUR_OF_DAY;
import static java.time.temporal.ChronoField.MINUTE_OF_HOUR;
import static java.time.temporal.ChronoField.NANO_OF_SECOND;
import static java.time.temporal.ChronoField.SECOND_OF_MINUTE;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;

/**
 * Helper utilities for canonical timestamp keys.
 *
 * <p>
 * A canonical key looks like {@code 2024-01-01 13:00:00+06:00}: local date and
 * time followed by an explicit fixed offset.
 * </p>
 */
public final class Timestamps {

	/** The canonical key format. */
	public static final DateTimeFormatter KEY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssxxx");

	/** A lenient local date time format accepting a space or {@code T}. */
	// @formatter:off
	public static final DateTimeFormatter LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
			.append(DateTimeFormatter.ISO_LOCAL_DATE)
			.optionalStart().appendLiteral(' ').optionalEnd()
			.optionalStart().appendLiteral('T').optionalEnd()
			.appendValue(HOUR_OF_DAY, 2)
			.appendLiteral(':')
			.appendValue(MINUTE_OF_HOUR, 2)
			.optionalStart()
			.appendLiteral(':')
			.appendValue(SECOND_OF_MINUTE, 2)
			.optionalStart()
			.appendFraction(NANO_OF_SECOND, 0, 9, true)
			.optionalEnd()
			.optionalEnd()
			.toFormatter();
	// @formatter:on

	/** Additional local date time formats found in workbook text cells. */
	private static final List<DateTimeFormatter> WORKBOOK_FORMATS = List.of(LOCAL_DATE_TIME,
			DateTimeFormatter.ofPattern("d/M/yyyy H:mm[:ss]"), DateTimeFormatter.ofPattern("M/d/yyyy H:mm[:ss]"));

	/** Local date formats found in workbook text cells. */
	private static final List<DateTimeFormatter> DATE_FORMATS = List.of(DateTimeFormatter.ISO_LOCAL_DATE,
			DateTimeFormatter.ofPattern("d/M/yyyy"), DateTimeFormatter.ofPattern("d-MMM-yyyy", Locale.ENGLISH));

	private Timestamps() {
		// not available
	}

	/**
	 * Format a local date time as a canonical key.
	 *
	 * @param dateTime the local date and time
	 * @param offset   the fixed offset of the local date and time
	 * @return the key
	 */
	public static String key(LocalDateTime dateTime, ZoneOffset offset) {
		return KEY_FORMAT.format(dateTime.truncatedTo(ChronoUnit.SECONDS).atOffset(offset));
	}

	/**
	 * Format an offset date time as a canonical key.
	 *
	 * @param dateTime the date and time
	 * @return the key
	 */
	public static String key(OffsetDateTime dateTime) {
		return KEY_FORMAT.format(dateTime.truncatedTo(ChronoUnit.SECONDS));
	}

	/**
	 * Parse a timestamp key.
	 *
	 * <p>
	 * Canonical keys and ISO 8601 offset date times are accepted. A key without
	 * an offset is interpreted with {@code defaultOffset}.
	 * </p>
	 *
	 * @param key           the key to parse
	 * @param defaultOffset the offset to apply to keys without one
	 * @return the parsed date time
	 * @throws DateTimeParseException if {@code key} cannot be parsed
	 */
	public static OffsetDateTime parseKey(String key, ZoneOffset defaultOffset) {
		final String k = key.strip();
		try {
			return OffsetDateTime.parse(k, KEY_FORMAT);
		} catch (DateTimeParseException e) {
			try {
				return OffsetDateTime.parse(k);
			} catch (DateTimeParseException e2) {
				return LocalDateTime.parse(k, LOCAL_DATE_TIME).atOffset(defaultOffset);
			}
		}
	}

	/**
	 * Parse a local date time from workbook cell text.
	 *
	 * @param text the text
	 * @return the date time
	 * @throws DateTimeParseException if {@code text} cannot be parsed
	 */
	public static LocalDateTime parseLocalDateTime(String text) {
		final String t = text.strip();
		DateTimeParseException first = null;
		for (DateTimeFormatter fmt : WORKBOOK_FORMATS) {
			try {
				return LocalDateTime.parse(t, fmt);
			} catch (DateTimeParseException e) {
				if (first == null) {
					first = e;
				}
			}
		}
		try {
			return parseLocalDate(t).atStartOfDay();
		} catch (DateTimeParseException e) {
			throw first;
		}
	}

	/**
	 * Parse a local date from workbook cell text.
	 *
	 * @param text the text
	 * @return the date
	 * @throws DateTimeParseException if {@code text} cannot be parsed
	 */
	public static LocalDate parseLocalDate(String text) {
		final String t = text.strip();
		DateTimeParseException first = null;
		for (DateTimeFormatter fmt : DATE_FORMATS) {
			try {
				return LocalDate.parse(t, fmt);
			} catch (DateTimeParseException e) {
				if (first == null) {
					first = e;
				}
			}
		}
		try {
			return LocalDateTime.parse(t, LOCAL_DATE_TIME).toLocalDate();
		} catch (DateTimeParseException e) {
			throw first;
		}
	}

	/**
	 * Validate a grid step.
	 *
	 * @param step the step
	 * @return the step
	 * @throws IllegalArgumentException if the step is not positive or longer than
	 *                                  one day
	 */
	public static Duration requireGridStep(Duration step) {
		if (step == null || step.isZero() || step.isNegative() || step.compareTo(Duration.ofDays(1)) > 0) {
			throw new IllegalArgumentException("Grid step must be positive and at most one day, but was " + step);
		}
		return step;
	}

	/**
	 * Test if a local date time falls on a grid anchored at local midnight.
	 *
	 * @param dateTime the date time
	 * @param step     the grid step
	 * @return {@code true} if aligned
	 */
	public static boolean isAligned(LocalDateTime dateTime, Duration step) {
		Duration sinceMidnight = Duration.between(dateTime.truncatedTo(ChronoUnit.DAYS), dateTime);
		return sinceMidnight.toNanos() % step.toNanos() == 0L;
	}

	/**
	 * Get the first grid point at or after a date time, for a grid anchored at
	 * local midnight.
	 *
	 * @param dateTime the date time
	 * @param step     the grid step
	 * @return the aligned date time
	 */
	public static OffsetDateTime alignCeiling(OffsetDateTime dateTime, Duration step) {
		OffsetDateTime midnight = dateTime.truncatedTo(ChronoUnit.DAYS);
		long since = Duration.between(midnight, dateTime).toNanos();
		long rem = since % step.toNanos();
		return (rem == 0L ? dateTime : dateTime.plusNanos(step.toNanos() - rem));
	}

}
