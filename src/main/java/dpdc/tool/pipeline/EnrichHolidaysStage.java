package dpdc.tool.pipeline;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;

import dpdc.tool.config.MigrationSettings;
import dpdc.tool.domain.HolidayCalendar;
import dpdc.tool.domain.Row;
import dpdc.tool.domain.Schema;
import dpdc.tool.domain.StageDescriptor;
import dpdc.tool.domain.StageOutcome;
import dpdc.tool.domain.Table;
import dpdc.tool.support.AtomicTableWriter;
import dpdc.tool.support.CsvTables;
import dpdc.tool.support.HolidayWorkbookReader;

/**
 * Add holiday columns to the merged load table.
 *
 * <p>
 * Rows are joined to the holiday calendar on the local calendar date of their
 * key.
 * </p>
 */
public class EnrichHolidaysStage extends AbstractStage {

	/** The holiday flag column. */
	public static final String IS_HOLIDAY = "is_holiday";

	/** The holiday type column. */
	public static final String HOLIDAY_TYPE = "holiday_type";

	/** The national event type column. */
	public static final String NATIONAL_EVENT_TYPE = "national_event_type";

	/**
	 * Constructor.
	 *
	 * @param settings the run settings
	 */
	public EnrichHolidaysStage(MigrationSettings settings) {
		super(settings, new StageDescriptor(2, "Enrich with holiday information",
				List.of(settings.masterDataFile(), settings.holidayFile()), settings.enrichedDataFile()));
	}

	@Override
	public List<String> plan() {
		// @formatter:off
		return List.of(
				  "Would read %s".formatted(settings.masterDataFile())
				, "Would read holidays from sheet [%s] of %s".formatted(settings.holidaySheet(), settings.holidayFile())
				, "Would create %s".formatted(descriptor().output())
			);
		// @formatter:on
	}

	@Override
	public StageOutcome execute(AtomicTableWriter writer) throws IOException {
		final List<String> warnings = new ArrayList<>();
		final Table master = canonicalTable(CsvTables.read(settings.masterDataFile()),
				name(settings.masterDataFile()), warnings);
		for (String col : List.of(IS_HOLIDAY, HOLIDAY_TYPE, NATIONAL_EVENT_TYPE)) {
			if (master.schema().contains(col)) {
				throw new StageExecutionException(
						"%s already has a [%s] column".formatted(settings.masterDataFile(), col));
			}
		}

		final HolidayCalendar calendar = new HolidayWorkbookReader(settings.holidaySheet())
				.read(settings.holidayFile());
		warnings.addAll(calendar.warnings());

		final Schema schema = master.schema().with(IS_HOLIDAY, HOLIDAY_TYPE, NATIONAL_EVENT_TYPE);
		final Table result = new Table(schema);
		int holidayRows = 0;
		for (Entry<String, Row> e : master.entries()) {
			final LocalDate date = canonicalTimestamp(e.getKey()).toLocalDate();
			final boolean holiday = calendar.isHoliday(date);
			if (holiday) {
				holidayRows++;
			}
			// @formatter:off
			result.putIfAbsent(e.getKey(), e.getValue().extend(schema
					, holiday ? "1" : "0"
					, String.valueOf(calendar.holidayType(date))
					, "0"));
			// @formatter:on
		}

		writer.write(descriptor().output(), result);

		// @formatter:off
		return new StageOutcome(result.size(), List.of(
				  "Holiday dates loaded: %d".formatted(calendar.size())
				, "Rows enriched: %d".formatted(result.size())
				, "Holiday rows: %d".formatted(holidayRows)
			), warnings);
		// @formatter:on
	}

}
