package dpdc.tool.config;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;

/**
 * The immutable settings of one migration run.
 * 
 * @param workbookDir              the directory of load workbooks
 * @param holidayFile              the holiday reference workbook
 * @param weatherFile              the weather table file
 * @param masterDataFile           the merged load table file
 * @param enrichedDataFile         the holiday enriched table file
 * @param mergedDataFile           the weather merged table file
 * @param outputDir                the final output directory
 * @param outputFileName           the final output file name
 * @param dryRun                   {@code true} to report what would be done
 *                                 without making changes
 * @param force                    {@code true} to rebuild outputs that already
 *                                 exist
 * @param zoneOffset               the fixed offset of all local timestamps
 * @param gridStep                 the time series grid step
 * @param holidaySheet             the holiday workbook sheet name
 * @param excludedWorkbookFragment a file name fragment of load workbooks to
 *                                 ignore
 */
public record MigrationSettings(Path workbookDir, Path holidayFile, Path weatherFile, Path masterDataFile,
		Path enrichedDataFile, Path mergedDataFile, Path outputDir, String outputFileName, boolean dryRun,
		boolean force, ZoneOffset zoneOffset, Duration gridStep, String holidaySheet,
		String excludedWorkbookFragment) {

	/** The default load workbook directory. */
	public static final String DEFAULT_WORKBOOK_DIR = "DPDC Load";

	/** The default holiday workbook. */
	public static final String DEFAULT_HOLIDAY_FILE = "Holiday List.xlsx";

	/** The default weather table file. */
	public static final String DEFAULT_WEATHER_FILE = "dhaka_weather_data.csv";

	/** The default merged load table file. */
	public static final String DEFAULT_MASTER_DATA_FILE = "master-data.csv";

	/** The default holiday enriched table file. */
	public static final String DEFAULT_ENRICHED_DATA_FILE = "master-data-enriched.csv";

	/** The default weather merged table file. */
	public static final String DEFAULT_MERGED_DATA_FILE = "merged_master_weather.csv";

	/** The default output directory. */
	public static final String DEFAULT_OUTPUT_DIR = "static";

	/** The default output file name. */
	public static final String DEFAULT_OUTPUT_FILE = "master_data_with_forecasted.csv";

	/**
	 * Create settings with default paths resolved against a base directory.
	 * 
	 * @param baseDir    the base directory
	 * @param properties the tool properties
	 * @return the settings
	 */
	public static MigrationSettings defaults(Path baseDir, ToolProperties properties) {
		// @formatter:off
		return new MigrationSettings(
				  baseDir.resolve(DEFAULT_WORKBOOK_DIR)
				, baseDir.resolve(DEFAULT_HOLIDAY_FILE)
				, baseDir.resolve(DEFAULT_WEATHER_FILE)
				, baseDir.resolve(DEFAULT_MASTER_DATA_FILE)
				, baseDir.resolve(DEFAULT_ENRICHED_DATA_FILE)
				, baseDir.resolve(DEFAULT_MERGED_DATA_FILE)
				, baseDir.resolve(DEFAULT_OUTPUT_DIR)
				, DEFAULT_OUTPUT_FILE
				, false
				, false
				, properties.offset()
				, properties.gridStep()
				, properties.holidaySheet()
				, properties.excludedWorkbookFragment()
			);
		// @formatter:on
	}

	/**
	 * Get the final output file path.
	 * 
	 * @return the path
	 */
	public Path outputFile() {
		return outputDir.resolve(outputFileName);
	}

}
