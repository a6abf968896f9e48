package dpdc.tool.validation.test;

import static org.assertj.core.api.BDDAssertions.then;
import static org.assertj.core.api.BDDAssertions.thenThrownBy;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import dpdc.tool.domain.DuplicateKey;
import dpdc.tool.domain.TimeSeriesValidationReport;
import dpdc.tool.validation.TimeSeriesValidator;

/**
 * Test cases for the {@link TimeSeriesValidator} class.
 */
public class TimeSeriesValidatorTests {

	private static final ZoneOffset OFFSET = ZoneOffset.ofHours(6);

	private final TimeSeriesValidator validator = new TimeSeriesValidator(Duration.ofHours(1), OFFSET, false);

	private static String key(String time) {
		return "2024-01-01 %s:00+06:00".formatted(time);
	}

	@Test
	public void clean() {
		// WHEN
		TimeSeriesValidationReport result = validator.validate(List.of(key("00:00"), key("01:00"), key("02:00")));

		// THEN
		then(result.passed()).isTrue();
		then(result.totalRows()).isEqualTo(3);
		then(result.expectedCount()).isEqualTo(3L);
		then(result.missingCount()).isZero();
		then(result.duplicateCount()).isZero();
	}

	@Test
	public void duplicates() {
		// GIVEN
		List<String> keys = List.of(key("00:00"), key("01:00"), key("00:00"), key("02:00"));

		// WHEN
		TimeSeriesValidationReport result = validator.validate(keys);

		// THEN
		then(result.duplicateCount()).as("One duplicated key").isEqualTo(1);
		then(result.duplicateOccurrences()).isEqualTo(2);
		then(result.duplicates()).containsExactly(new DuplicateKey(key("00:00"), List.of(0, 2)));
		then(result.missingCount()).isZero();
		then(result.passed()).isFalse();
	}

	@Test
	public void duplicates_differentOffsets() {
		// GIVEN
		List<String> keys = List.of(key("06:00"), "2024-01-01T00:00:00Z");

		// WHEN
		TimeSeriesValidationReport result = validator.validate(keys);

		// THEN
		then(result.duplicates()).as("Same instant is a duplicate")
				.containsExactly(new DuplicateKey(key("06:00"), List.of(0, 1)));
	}

	@Test
	public void missing() {
		// WHEN
		TimeSeriesValidationReport result = validator.validate(List.of(key("00:00"), key("01:00"), key("03:00")));

		// THEN
		then(result.missing()).containsExactly(key("02:00"));
		then(result.expectedCount()).isEqualTo(4L);
		then(result.passed()).isFalse();
	}

	@Test
	public void empty() {
		// WHEN
		TimeSeriesValidationReport result = validator.validate(List.of());

		// THEN
		then(result.passed()).as("Empty input is vacuously valid").isTrue();
		then(result.totalRows()).isZero();
		then(result.expectedCount()).isZero();
		then(result.range()).isNull();
	}

	@Test
	public void offGrid() {
		// WHEN
		TimeSeriesValidationReport result = validator.validate(List.of(key("00:00"), key("00:30"), key("01:00")));

		// THEN
		then(result.extra()).containsExactly(key("00:30"));
		then(result.missingCount()).isZero();
		then(result.passed()).as("Extras do not fail validation").isTrue();
	}

	@Test
	public void alignToMidnight() {
		// GIVEN
		TimeSeriesValidator v = new TimeSeriesValidator(Duration.ofHours(1), OFFSET, true);

		// WHEN
		TimeSeriesValidationReport result = v.validate(List.of(key("00:30"), key("01:00"), key("02:00")));

		// THEN
		then(result.expectedCount()).as("Grid starts at first whole hour").isEqualTo(2L);
		then(result.extra()).containsExactly(key("00:30"));
		then(result.missingCount()).isZero();
	}

	@Test
	public void externalRange() {
		// GIVEN
		OffsetDateTime start = OffsetDateTime.parse("2024-01-01T00:00:00+06:00");
		OffsetDateTime end = OffsetDateTime.parse("2024-01-01T03:00:00+06:00");

		// WHEN
		TimeSeriesValidationReport result = validator.validate(List.of(key("01:00"), key("02:00"), key("05:00")),
				start, end);

		// THEN
		then(result.expectedCount()).isEqualTo(4L);
		then(result.missing()).containsExactly(key("00:00"), key("03:00"));
		then(result.outOfRange()).containsExactly(key("05:00"));
		then(result.extraCount()).isZero();
	}

	@Test
	public void externalRange_invalid() {
		OffsetDateTime start = OffsetDateTime.parse("2024-01-02T00:00:00+06:00");
		OffsetDateTime end = OffsetDateTime.parse("2024-01-01T00:00:00+06:00");
		thenThrownBy(() -> validator.validate(List.of(key("00:00")), start, end))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	public void unparseable() {
		// WHEN
		TimeSeriesValidationReport result = validator.validate(List.of("garbage", key("00:00"), key("01:00")));

		// THEN
		then(result.unparseable()).containsExactly("garbage");
		then(result.totalRows()).isEqualTo(3);
		then(result.passed()).as("Unparseable keys reported separately").isTrue();
	}

	@Test
	public void endOnlyBeforeData() {
		// GIVEN
		OffsetDateTime end = OffsetDateTime.parse("2023-12-31T00:00:00+06:00");

		// THEN
		thenThrownBy(() -> validator.validate(List.of(key("00:00"), key("01:00")), null, end))
				.isInstanceOf(IllegalArgumentException.class).hasMessageContaining("2023-12-31 00:00:00+06:00");
	}

	@Test
	public void startOnlyAfterData() {
		// GIVEN
		OffsetDateTime start = OffsetDateTime.parse("2024-02-01T00:00:00+06:00");

		// THEN
		thenThrownBy(() -> validator.validate(List.of(key("00:00"), key("01:00")), start, null))
				.isInstanceOf(IllegalArgumentException.class).hasMessageContaining("2024-02-01 00:00:00+06:00");
	}

	@Test
	public void endOnlyWithinData() {
		// GIVEN
		OffsetDateTime end = OffsetDateTime.parse("2024-01-01T01:00:00+06:00");

		// WHEN
		TimeSeriesValidationReport result = validator.validate(List.of(key("00:00"), key("01:00"), key("02:00")),
				null, end);

		// THEN
		then(result.expectedCount()).isEqualTo(2L);
		then(result.outOfRange()).containsExactly(key("02:00"));
		then(result.passed()).isTrue();
	}

	@Test
	public void allUnparseable() {
		// WHEN
		TimeSeriesValidationReport result = validator.validate(List.of("garbage", "junk"));

		// THEN
		then(result.totalRows()).isEqualTo(2);
		then(result.unparseable()).containsExactly("garbage", "junk");
		then(result.hasValidKeys()).isFalse();
		then(result.passed()).as("No valid timestamp at all").isFalse();
	}

}
