package dpdc.tool.support;

import java.math.BigDecimal;
import java.net.URI;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dpdc.tool.config.ToolProperties;
import dpdc.tool.domain.KeyedRow;
import dpdc.tool.domain.RecordResult;
import dpdc.tool.domain.Schema;

/**
 * Helper utilities for the Meteostat JSON API.
 */
public final class MeteostatRestUtils {

	/** The API key request header. */
	public static final String API_KEY_HEADER = "x-rapidapi-key";

	/** The API host request header. */
	public static final String API_HOST_HEADER = "x-rapidapi-host";

	/** The hourly point data path. */
	public static final String HOURLY_PATH = "/point/hourly";

	/** The local time format of observation timestamps. */
	public static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private MeteostatRestUtils() {
		// not available
	}

	/**
	 * Set the ObjectMapper used by a {@link RestTemplate}.
	 *
	 * @param template     the template to adjust
	 * @param objectMapper the object mapper to use
	 */
	public static void setObjectMapper(RestTemplate template, ObjectMapper objectMapper) {
		for (HttpMessageConverter<?> converter : template.getMessageConverters()) {
			if (converter instanceof MappingJackson2HttpMessageConverter c) {
				c.setObjectMapper(objectMapper);
			}
		}
	}

	/**
	 * Create a new {@link RestClient} instance.
	 *
	 * <p>
	 * The client will automatically add the API key and host headers to each
	 * request.
	 * </p>
	 *
	 * @param reqFactory   the request factory
	 * @param objectMapper the object mapper
	 * @param baseUrl      the base URL
	 * @param apiKey       the API key
	 * @return the client
	 */
	public static RestClient createMeteostatRestClient(ClientHttpRequestFactory reqFactory, ObjectMapper objectMapper,
			String baseUrl, String apiKey) {
		RestTemplate template = new RestTemplate(reqFactory);
		setObjectMapper(template, objectMapper);
		// @formatter:off
		return RestClient.builder(template)
				.baseUrl(baseUrl)
				.defaultHeader(API_KEY_HEADER, apiKey)
				.defaultHeader(API_HOST_HEADER, URI.create(baseUrl).getHost())
				.build();
		// @formatter:on
	}

	/**
	 * Query for hourly observations at a point.
	 *
	 * @param restClient the REST client to use
	 * @param weather    the point and time zone settings
	 * @param startDate  the first local date
	 * @param endDate    the last local date (inclusive)
	 * @return the response body
	 * @throws RestClientException if the request fails
	 */
	public static JsonNode hourly(RestClient restClient, ToolProperties.Weather weather, LocalDate startDate,
			LocalDate endDate) {
		// @formatter:off
		return restClient.get()
			.uri(b -> {
				b.path(HOURLY_PATH)
					.queryParam("lat", weather.latitude())
					.queryParam("lon", weather.longitude())
					.queryParam("alt", weather.altitude())
					.queryParam("start", startDate)
					.queryParam("end", endDate)
					.queryParam("tz", weather.timeZone())
					;
				return b.build();
			})
			.accept(MediaType.APPLICATION_JSON)
			.retrieve()
			.body(JsonNode.class)
			;
		// @formatter:on
	}

	/**
	 * Get the observation records of an hourly response.
	 *
	 * @param body   the response body
	 * @param offset the offset of the local observation times
	 * @param schema the columns to extract
	 * @param seen   a set to add every observation property name found to
	 * @return the records; missing or {@code null} properties produce empty
	 *         values
	 */
	public static List<RecordResult> observations(JsonNode body, ZoneOffset offset, Schema schema, Set<String> seen) {
		final JsonNode data = (body != null ? body.path("data") : null);
		if (data == null || !data.isArray()) {
			return List.of();
		}
		final List<RecordResult> results = new ArrayList<>(data.size());
		for (JsonNode obs : data) {
			obs.fieldNames().forEachRemaining(seen::add);
			final String time = obs.path("time").asText("");
			final LocalDateTime ts;
			try {
				ts = LocalDateTime.parse(time, TIME_FORMAT);
			} catch (DateTimeParseException e) {
				results.add(RecordResult.skipped("observation has invalid time [%s]".formatted(time)));
				continue;
			}
			final List<String> values = new ArrayList<>(schema.size());
			for (String col : schema.columns()) {
				values.add(value(obs.get(col)));
			}
			results.add(RecordResult.parsed(new KeyedRow(Timestamps.key(ts, offset), values)));
		}
		return results;
	}

	private static String value(JsonNode node) {
		if (node == null || node.isNull()) {
			return "";
		}
		if (node.isNumber()) {
			BigDecimal d = node.decimalValue().stripTrailingZeros();
			return (d.scale() < 0 ? d.setScale(0) : d).toPlainString();
		}
		return node.asText();
	}

}
