package dpdc.tool.config;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tool defaults, bound from the {@code dpdc.tool.*} properties.
 * 
 * <pre>
 * dpdc:
 *   tool:
 *     zone-offset: "+06:00"
 *     grid-step: PT1H
 *     holiday-sheet: List of Holidays
 *     excluded-workbook-fragment: all_data
 *     weather:
 *       base-url: https://meteostat.p.rapidapi.com
 *       api-key: ...
 * </pre>
 * 
 * @param zoneOffset               the fixed offset of all local timestamps
 * @param gridStep                 the time series grid step
 * @param holidaySheet             the holiday workbook sheet name
 * @param excludedWorkbookFragment a file name fragment of load workbooks to
 *                                 ignore
 * @param weather                  the weather service settings
 */
@ConfigurationProperties(prefix = "dpdc.tool")
public record ToolProperties(@DefaultValue("+06:00") String zoneOffset, @DefaultValue("PT1H") Duration gridStep,
		@DefaultValue("List of Holidays") String holidaySheet,
		@DefaultValue("all_data") String excludedWorkbookFragment, @DefaultValue Weather weather) {

	/**
	 * Get the zone offset.
	 * 
	 * @return the offset
	 */
	public ZoneOffset offset() {
		return ZoneOffset.of(zoneOffset);
	}

	/**
	 * Weather service settings.
	 * 
	 * @param baseUrl     the Meteostat API base URL
	 * @param apiKey      the API key
	 * @param latitude    the observation point latitude
	 * @param longitude   the observation point longitude
	 * @param altitude    the observation point altitude, in meters
	 * @param timeZone    the time zone the API should report local times in
	 * @param maxAttempts the maximum number of attempts per request
	 * @param backoffBase the delay before the first retry, doubled for each
	 *                    further retry
	 * @param maxDays     the maximum number of days per request
	 */
	public record Weather(@DefaultValue("https://meteostat.p.rapidapi.com") String baseUrl, String apiKey,
			@DefaultValue("23.8103") double latitude, @DefaultValue("90.4125") double longitude,
			@DefaultValue("8") int altitude, @DefaultValue("Asia/Dhaka") String timeZone,
			@DefaultValue("4") int maxAttempts, @DefaultValue("PT4S") Duration backoffBase,
			@DefaultValue("30") int maxDays) {

		/**
		 * Get the time zone.
		 * 
		 * @return the zone
		 */
		public ZoneId zone() {
			return ZoneId.of(timeZone);
		}

	}

}
