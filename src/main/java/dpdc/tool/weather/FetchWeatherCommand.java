package dpdc.tool.weather;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Iterator;
import java.util.concurrent.Callable;

import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import com.fasterxml.jackson.databind.ObjectMapper;

import dpdc.tool.config.ToolProperties;
import dpdc.tool.domain.Row;
import dpdc.tool.domain.Table;
import dpdc.tool.domain.WeatherFetchResult;
import dpdc.tool.support.AtomicTableWriter;
import dpdc.tool.support.MeteostatRestUtils;
import dpdc.tool.support.Verbosity;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;

/**
 * Download hourly weather observations into a table file.
 */
@Component
@Command(name = "fetch-weather", description = "Download hourly weather observations for the configured location.")
public class FetchWeatherCommand implements Callable<Integer> {

	@Option(names = { "-v", "--verbose" }, description = "verbose output")
	boolean[] verbosity;

	@Option(names = { "-h", "--help" }, usageHelp = true, description = "display this help message")
	boolean usageHelpRequested;

	@Option(names = { "-s", "--start-date" }, description = "the first date to fetch, as YYYY-MM-DD", required = true)
	LocalDate startDate;

	@Option(names = { "-e", "--end-date" }, description = "the last date to fetch, as YYYY-MM-DD", required = true)
	LocalDate endDate;

	@Option(names = { "-o", "--output" }, description = "the CSV file to write", defaultValue = "dhaka_weather_data.csv")
	Path output;

	@Option(names = { "-k", "--api-key" }, description = "the Meteostat API key")
	String apiKey;

	private final ClientHttpRequestFactory reqFactory;
	private final ObjectMapper objectMapper;
	private final ToolProperties properties;
	private final AtomicTableWriter writer;

	/**
	 * Constructor.
	 *
	 * @param reqFactory   the HTTP request factory to use
	 * @param objectMapper the mapper to use
	 * @param properties   the tool properties
	 * @param writer       the writer to save the observations with
	 */
	public FetchWeatherCommand(ClientHttpRequestFactory reqFactory, ObjectMapper objectMapper,
			ToolProperties properties, AtomicTableWriter writer) {
		super();
		this.reqFactory = reqFactory;
		this.objectMapper = objectMapper;
		this.properties = properties;
		this.writer = writer;
	}

	@Override
	public Integer call() throws Exception {
		Verbosity.apply(verbosity);
		if (startDate.isAfter(endDate)) {
			System.out.println(Ansi.AUTO.string("@|red Invalid argument:|@ start date %s is after end date %s"
					.formatted(startDate, endDate)));
			return 1;
		}
		final ToolProperties.Weather weather = properties.weather();
		final String key = (apiKey != null ? apiKey : weather.apiKey());
		if (key == null || key.isBlank()) {
			System.out.println(Ansi.AUTO.string(
					"@|red No API key:|@ use --api-key or set the dpdc.tool.weather.api-key property."));
			return 1;
		}

		// @formatter:off
		System.out.print(Ansi.AUTO.string("""
				Fetching weather data
				  @|bold Location:|@   lat=%s, lon=%s, alt=%dm
				  @|bold Date range:|@ %s to %s
				""".formatted(
						  weather.latitude()
						, weather.longitude()
						, weather.altitude()
						, startDate
						, endDate
					)
				));
		// @formatter:on

		final RestClient restClient = MeteostatRestUtils.createMeteostatRestClient(reqFactory, objectMapper,
				weather.baseUrl(), key);
		final WeatherFetcher fetcher = new WeatherFetcher((s, e) -> MeteostatRestUtils.hourly(restClient, weather, s, e),
				properties.offset(), weather.maxAttempts(), weather.backoffBase(), weather.maxDays(),
				WeatherFetcher.THREAD_SLEEPER);

		final WeatherFetchResult result;
		try {
			result = fetcher.fetch(startDate, endDate);
		} catch (RestClientResponseException e) {
			System.out.println(Ansi.AUTO.string(
					"@|red Error fetching weather data:|@ HTTP status %s returned.".formatted(e.getStatusCode())));
			return 1;
		} catch (RestClientException | IllegalStateException e) {
			System.out.println(Ansi.AUTO.string("@|red Error fetching weather data:|@ %s".formatted(e.getMessage())));
			return 1;
		}

		for (String w : result.warnings()) {
			System.out.println(Ansi.AUTO.string("@|yellow Warning:|@ " + w));
		}
		final Table table = result.table();
		if (table.isEmpty()) {
			System.out.println(Ansi.AUTO.string("@|red No weather data retrieved.|@"));
			return 1;
		}

		writer.write(output, table);

		// @formatter:off
		System.out.print(Ansi.AUTO.string("""
				@|green Data saved to:|@ %s
				  @|bold Records:|@    %d
				  @|bold Date range:|@ %s to %s
				  @|bold Columns:|@    %s
				""".formatted(
						  output
						, table.size()
						, firstKey(table)
						, lastKey(table)
						, String.join(", ", table.schema().header())
					)
				));
		// @formatter:on
		printMissingValues(table);
		return 0;
	}

	private static String firstKey(Table table) {
		return table.keys().iterator().next();
	}

	private static String lastKey(Table table) {
		String last = null;
		for (Iterator<String> itr = table.keys().iterator(); itr.hasNext();) {
			last = itr.next();
		}
		return last;
	}

	private static void printMissingValues(Table table) {
		final int[] counts = new int[table.schema().size()];
		for (var e : table.entries()) {
			Row row = e.getValue();
			for (int i = 0; i < counts.length; i++) {
				if (row.get(i).isEmpty()) {
					counts[i]++;
				}
			}
		}
		boolean header = false;
		for (int i = 0; i < counts.length; i++) {
			if (counts[i] < 1) {
				continue;
			}
			if (!header) {
				System.out.println("Missing values per column:");
				header = true;
			}
			System.out.println("  %s: %d (%.1f%%)".formatted(table.schema().columns().get(i), counts[i],
					counts[i] * 100.0 / table.size()));
		}
	}

}
