package dpdc.tool.weather.test;

import static org.assertj.core.api.BDDAssertions.then;
import static org.assertj.core.api.BDDAssertions.thenThrownBy;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dpdc.tool.domain.Row;
import dpdc.tool.domain.WeatherFetchResult;
import dpdc.tool.weather.WeatherFetcher;

/**
 * Test cases for the {@link WeatherFetcher} class.
 */
public class WeatherFetcherTests {

	private static final ZoneOffset OFFSET = ZoneOffset.ofHours(6);

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final List<Duration> sleeps = new ArrayList<>();
	private final List<LocalDate[]> calls = new ArrayList<>();
	private final Deque<Supplier<JsonNode>> responses = new ArrayDeque<>();

	private static JsonNode json(String s) {
		try {
			return MAPPER.readTree(s.replace('\'', '"'));
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException(e);
		}
	}

	private static JsonNode observation(String time, Object temp) {
		// @formatter:off
		return json("""
				{'data':[{'time':'%s','temp':%s,'dwpt':10.0,'rhum':80,'prcp':0.0,'wdir':180,
				'wspd':5.4,'pres':1010.0,'coco':1}]}
				""".formatted(time, temp));
		// @formatter:on
	}

	private static Supplier<JsonNode> failure() {
		return () -> {
			throw new ResourceAccessException("Connection timed out");
		};
	}

	private WeatherFetcher fetcher(int maxAttempts, int maxDays) {
		return new WeatherFetcher((s, e) -> {
			calls.add(new LocalDate[] { s, e });
			return responses.removeFirst().get();
		}, OFFSET, maxAttempts, Duration.ofSeconds(4), maxDays, sleeps::add);
	}

	@Test
	public void backoff() {
		WeatherFetcher f = fetcher(4, 30);
		then(f.backoff(0)).isEqualTo(Duration.ofSeconds(4));
		then(f.backoff(1)).isEqualTo(Duration.ofSeconds(8));
		then(f.backoff(2)).isEqualTo(Duration.ofSeconds(16));
	}

	@Test
	public void fetch_retryThenSuccess() {
		// GIVEN
		responses.add(failure());
		responses.add(() -> json("{'data':[]}"));
		responses.add(() -> observation("2024-01-01 00:00:00", 20.5));

		// WHEN
		WeatherFetchResult result = fetcher(4, 30).fetch(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1));

		// THEN
		then(result.requests()).isEqualTo(3);
		then(sleeps).as("Exponential pauses between attempts").containsExactly(Duration.ofSeconds(4),
				Duration.ofSeconds(8));
		then(result.table().size()).isEqualTo(1);
		then(result.warnings()).isEmpty();
	}

	@Test
	public void fetch_allAttemptsFail() {
		// GIVEN
		for (int i = 0; i < 4; i++) {
			responses.add(failure());
		}

		// THEN
		thenThrownBy(() -> fetcher(4, 30).fetch(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1)))
				.isInstanceOf(ResourceAccessException.class).hasMessageContaining("timed out");
		then(sleeps).as("No pause after the last attempt").containsExactly(Duration.ofSeconds(4),
				Duration.ofSeconds(8), Duration.ofSeconds(16));
	}

	@Test
	public void fetch_alwaysEmpty() {
		// GIVEN
		responses.add(() -> json("{'data':[]}"));
		responses.add(() -> json("{'data':null}"));

		// WHEN
		WeatherFetchResult result = fetcher(2, 30).fetch(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2));

		// THEN
		then(result.table().isEmpty()).isTrue();
		then(result.warnings()).containsExactly("No weather data retrieved for 2024-01-01 - 2024-01-02");
	}

	@Test
	public void fetch_chunks() {
		// GIVEN
		responses.add(() -> observation("2024-01-30 23:00:00", 18));
		responses.add(() -> observation("2024-01-31 00:00:00", 17));

		// WHEN
		WeatherFetchResult result = fetcher(1, 30).fetch(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 15));

		// THEN
		then(calls).hasSize(2);
		then(calls.get(0)).containsExactly(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 30));
		then(calls.get(1)).containsExactly(LocalDate.of(2024, 1, 31), LocalDate.of(2024, 2, 15));
		then(result.table().keys()).containsExactly("2024-01-30 23:00:00+06:00", "2024-01-31 00:00:00+06:00");
	}

	@Test
	public void fetch_values() {
		// GIVEN
		responses.add(() -> observation("2024-01-01 00:00:00", "null"));

		// WHEN
		WeatherFetchResult result = fetcher(1, 30).fetch(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1));

		// THEN
		Row row = result.table().get("2024-01-01 00:00:00+06:00");
		then(row).isNotNull();
		then(row.get("temp")).as("Null value empty").isEmpty();
		then(row.get("dwpt")).as("Trailing zeros dropped").isEqualTo("10");
		then(row.get("wspd")).isEqualTo("5.4");
		then(row.get("pres")).isEqualTo("1010");
	}

	@Test
	public void fetch_missingColumn() {
		// GIVEN
		responses.add(() -> json("{'data':[{'time':'2024-01-01 00:00:00','temp':20,'dwpt':10,'rhum':80,"
				+ "'prcp':0,'wdir':180,'wspd':5,'pres':1010}]}"));

		// WHEN
		WeatherFetchResult result = fetcher(1, 30).fetch(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1));

		// THEN
		then(result.warnings()).containsExactly("Some columns are missing in the data: coco");
		then(result.table().schema().header()).contains("coco");
		then(result.table().get("2024-01-01 00:00:00+06:00").get("coco")).isEmpty();
	}

	@Test
	public void fetch_invalidRange() {
		thenThrownBy(() -> fetcher(1, 30).fetch(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 1)))
				.isInstanceOf(IllegalArgumentException.class);
		then(calls).isEmpty();
	}

	@Test
	public void constructor_invalid() {
		thenThrownBy(() -> fetcher(0, 30)).isInstanceOf(IllegalArgumentException.class);
		thenThrownBy(() -> fetcher(1, 0)).isInstanceOf(IllegalArgumentException.class);
	}

}
