package dpdc.tool.weather;

import static java.util.stream.Collectors.joining;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.databind.JsonNode;

import dpdc.tool.domain.KeyedRow;
import dpdc.tool.domain.RecordResult;
import dpdc.tool.domain.Schema;
import dpdc.tool.domain.SourceReadResult;
import dpdc.tool.domain.Table;
import dpdc.tool.domain.WeatherFetchResult;
import dpdc.tool.support.MeteostatRestUtils;

/**
 * Fetch hourly weather observations for a date range.
 *
 * <p>
 * The range is requested in chunks of at most {@code maxDays} days. A chunk
 * request that fails, or that returns no observations, is retried after a
 * pause of {@code backoffBase * 2^attempt}, up to {@code maxAttempts} attempts.
 * A chunk that still fails ends the fetch with the last error; a chunk that is
 * still empty is reported as a warning.
 * </p>
 */
public class WeatherFetcher {

	private static final Logger log = LoggerFactory.getLogger(WeatherFetcher.class);

	/** The weather observation columns. */
	public static final Schema WEATHER_SCHEMA = Schema.of("temp", "dwpt", "rhum", "prcp", "wdir", "wspd", "pres",
			"coco");

	/**
	 * API for a source of hourly observations.
	 */
	@FunctionalInterface
	public interface HourlySource {

		/**
		 * Query for hourly observations.
		 *
		 * @param startDate the first local date
		 * @param endDate   the last local date (inclusive)
		 * @return the response body
		 * @throws RestClientException if the request fails
		 */
		JsonNode hourly(LocalDate startDate, LocalDate endDate);

	}

	/**
	 * API for pausing between attempts.
	 */
	@FunctionalInterface
	public interface Sleeper {

		/**
		 * Pause.
		 *
		 * @param duration the time to pause for
		 * @throws InterruptedException if interrupted
		 */
		void sleep(Duration duration) throws InterruptedException;

	}

	/** A sleeper that pauses the calling thread. */
	public static final Sleeper THREAD_SLEEPER = d -> Thread.sleep(d.toMillis());

	private final HourlySource source;
	private final ZoneOffset offset;
	private final int maxAttempts;
	private final Duration backoffBase;
	private final int maxDays;
	private final Sleeper sleeper;

	/**
	 * Constructor.
	 *
	 * @param source      the observation source
	 * @param offset      the offset of the local observation times
	 * @param maxAttempts the maximum number of attempts per chunk
	 * @param backoffBase the pause after the first failed attempt
	 * @param maxDays     the maximum number of days per request
	 * @param sleeper     the sleeper
	 * @throws IllegalArgumentException if {@code maxAttempts} or {@code maxDays}
	 *                                  is less than 1
	 */
	public WeatherFetcher(HourlySource source, ZoneOffset offset, int maxAttempts, Duration backoffBase, int maxDays,
			Sleeper sleeper) {
		super();
		if (maxAttempts < 1 || maxDays < 1) {
			throw new IllegalArgumentException("The maxAttempts and maxDays arguments must be at least 1.");
		}
		this.source = source;
		this.offset = offset;
		this.maxAttempts = maxAttempts;
		this.backoffBase = backoffBase;
		this.maxDays = maxDays;
		this.sleeper = sleeper;
	}

	/**
	 * Get the pause before the attempt following a failed one.
	 *
	 * @param attempt the 0-based failed attempt
	 * @return the pause
	 */
	public Duration backoff(int attempt) {
		return backoffBase.multipliedBy(1L << attempt);
	}

	/**
	 * Fetch observations.
	 *
	 * @param startDate the first local date
	 * @param endDate   the last local date (inclusive)
	 * @return the result
	 * @throws IllegalArgumentException if {@code startDate} is after
	 *                                  {@code endDate}
	 * @throws RestClientException      if a chunk request fails on every attempt
	 * @throws IllegalStateException    if interrupted while pausing
	 */
	public WeatherFetchResult fetch(LocalDate startDate, LocalDate endDate) {
		if (startDate.isAfter(endDate)) {
			throw new IllegalArgumentException(
					"The start date %s must not be after the end date %s".formatted(startDate, endDate));
		}
		final List<KeyedRow> rows = new ArrayList<>();
		final List<String> warnings = new ArrayList<>();
		final Set<String> seen = new HashSet<>();
		int requests = 0;
		for (LocalDate chunkStart = startDate; !chunkStart.isAfter(endDate); chunkStart = chunkStart
				.plusDays(maxDays)) {
			final LocalDate chunkEnd = min(chunkStart.plusDays(maxDays - 1), endDate);
			final String chunk = "%s - %s".formatted(chunkStart, chunkEnd);
			List<RecordResult> results = List.of();
			RestClientException lastError = null;
			for (int attempt = 0; attempt < maxAttempts; attempt++) {
				requests++;
				log.info("Fetching weather data {} (attempt {}/{})", chunk, attempt + 1, maxAttempts);
				try {
					JsonNode body = this.source.hourly(chunkStart, chunkEnd);
					results = MeteostatRestUtils.observations(body, offset, WEATHER_SCHEMA, seen);
					lastError = null;
					if (!results.isEmpty()) {
						break;
					}
					log.warn("Empty weather result for {}", chunk);
				} catch (RestClientException e) {
					lastError = e;
					log.warn("Error fetching weather data for {}: {}", chunk, e.getMessage());
				}
				if (attempt + 1 < maxAttempts) {
					pause(backoff(attempt));
				}
			}
			if (lastError != null) {
				throw lastError;
			}
			if (results.isEmpty()) {
				warnings.add("No weather data retrieved for %s".formatted(chunk));
				continue;
			}
			SourceReadResult r = SourceReadResult.of(chunk, results, 0);
			rows.addAll(r.rows());
			warnings.addAll(r.warnings());
		}

		if (!rows.isEmpty()) {
			List<String> missing = WEATHER_SCHEMA.columns().stream().filter(c -> !seen.contains(c)).toList();
			if (!missing.isEmpty()) {
				warnings.add("Some columns are missing in the data: " + missing.stream().collect(joining(", ")));
			}
		}

		rows.sort(Comparator.comparing(KeyedRow::key));
		final Table table = Table.fromRecords(WEATHER_SCHEMA, rows);
		if (table.size() < rows.size()) {
			warnings.add("%d duplicate observation times ignored".formatted(rows.size() - table.size()));
		}
		for (String w : warnings) {
			log.warn(w);
		}
		return new WeatherFetchResult(table, warnings, requests);
	}

	private void pause(Duration duration) {
		log.info("Retrying in {}s", duration.toSeconds());
		try {
			sleeper.sleep(duration);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while waiting to retry weather request", e);
		}
	}

	private static LocalDate min(LocalDate a, LocalDate b) {
		return (a.isBefore(b) ? a : b);
	}

}
