package dpdc.tool.support;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dpdc.tool.domain.KeyedRow;
import dpdc.tool.domain.RecordResult;
import dpdc.tool.domain.Schema;
import dpdc.tool.domain.SourceReadResult;

/**
 * Read hourly load exports from spreadsheet workbooks.
 *
 * <p>
 * The first sheet of each workbook holds a header row followed by rows with
 * the timestamp in column A, the actual load in column B and the forecasted
 * load in column D.
 * </p>
 */
public class LoadWorkbookReader {

	private static final Logger log = LoggerFactory.getLogger(LoadWorkbookReader.class);

	/** The schema of the rows produced by this reader. */
	public static final Schema LOAD_SCHEMA = Schema.of("load", "forecasted_load");

	/** The workbook file name extension. */
	public static final String WORKBOOK_EXTENSION = ".xlsx";

	private static final int TIMESTAMP_COL = 0;
	private static final int LOAD_COL = 1;
	private static final int FORECAST_COL = 3;

	private final ZoneOffset offset;
	private final Duration gridStep;

	/**
	 * Constructor.
	 *
	 * @param offset   the fixed offset of the workbook local times
	 * @param gridStep the grid step rows must align to; other rows are filtered
	 */
	public LoadWorkbookReader(ZoneOffset offset, Duration gridStep) {
		super();
		this.offset = offset;
		this.gridStep = Timestamps.requireGridStep(gridStep);
	}

	/**
	 * List the workbooks in a directory tree.
	 *
	 * @param dir              the directory to search
	 * @param excludedFragment a case-insensitive file name fragment to exclude,
	 *                         or {@code null}
	 * @return the workbook paths, sorted
	 * @throws IOException if any IO error occurs
	 */
	public static List<Path> listWorkbooks(Path dir, String excludedFragment) throws IOException {
		final String excluded = (excludedFragment != null && !excludedFragment.isBlank()
				? excludedFragment.toLowerCase(Locale.ROOT)
				: null);
		try (Stream<Path> paths = Files.walk(dir)) {
			// @formatter:off
			return paths
					.filter(Files::isRegularFile)
					.filter(p -> {
						String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
						return name.endsWith(WORKBOOK_EXTENSION) && !(excluded != null && name.contains(excluded));
					})
					.sorted()
					.toList();
			// @formatter:on
		}
	}

	/**
	 * Read the load rows of a workbook.
	 *
	 * <p>
	 * A workbook that cannot be opened produces a result with no rows and a
	 * single warning.
	 * </p>
	 *
	 * @param path the workbook to read
	 * @return the result
	 */
	public SourceReadResult read(Path path) {
		final String source = String.valueOf(path.getFileName());
		try (Workbook wb = WorkbookFactory.create(path.toFile(), null, true)) {
			if (wb.getNumberOfSheets() < 1) {
				return SourceReadResult.failed(source + ": no sheets");
			}
			final Sheet sheet = wb.getSheetAt(0);
			final List<RecordResult> results = new ArrayList<>(sheet.getLastRowNum() + 1);
			int filtered = 0;
			boolean header = true;
			for (Row row : sheet) {
				if (header) {
					header = false;
					continue;
				}
				if (isEmptyRow(row)) {
					continue;
				}
				RecordResult r = record(row);
				if (r == null) {
					filtered++;
				} else {
					results.add(r);
				}
			}
			return SourceReadResult.of(source, results, filtered);
		} catch (IOException | RuntimeException e) {
			log.warn("Error reading workbook {}: {}", path, e.toString());
			return SourceReadResult.failed("%s: unreadable workbook (%s)".formatted(source, e.getMessage()));
		}
	}

	private static boolean isEmptyRow(Row row) {
		return WorkbookCells.isBlank(WorkbookCells.cell(row, TIMESTAMP_COL))
				&& WorkbookCells.isBlank(WorkbookCells.cell(row, LOAD_COL))
				&& WorkbookCells.isBlank(WorkbookCells.cell(row, FORECAST_COL));
	}

	/**
	 * Convert a sheet row.
	 *
	 * @param row the row
	 * @return the result, or {@code null} if the row is not on the grid
	 */
	private RecordResult record(Row row) {
		final int rowNum = row.getRowNum() + 1;
		final LocalDateTime ts;
		try {
			ts = WorkbookCells.dateTime(WorkbookCells.cell(row, TIMESTAMP_COL));
		} catch (DateTimeException e) {
			return RecordResult.skipped("row %d has invalid timestamp (%s)".formatted(rowNum, e.getMessage()));
		}
		if (ts == null) {
			return RecordResult.skipped("row %d has no timestamp".formatted(rowNum));
		}
		if (!Timestamps.isAligned(ts, gridStep)) {
			return null;
		}
		final String load;
		final String forecast;
		try {
			load = WorkbookCells.number(WorkbookCells.cell(row, LOAD_COL));
		} catch (NumberFormatException e) {
			return RecordResult.skipped("row %d has non-numeric load".formatted(rowNum));
		}
		try {
			forecast = WorkbookCells.number(WorkbookCells.cell(row, FORECAST_COL));
		} catch (NumberFormatException e) {
			return RecordResult.skipped("row %d has non-numeric forecasted load".formatted(rowNum));
		}
		return RecordResult.parsed(new KeyedRow(Timestamps.key(ts, offset), List.of(load, forecast)));
	}

}
