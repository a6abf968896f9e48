package dpdc.tool.support;

import java.io.IOException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dpdc.tool.domain.HolidayCalendar;

/**
 * Read the holiday reference workbook.
 *
 * <p>
 * The holiday sheet holds a header row followed by rows with the holiday date
 * in column A and an integer holiday type in column D. Rows missing either
 * value are ignored; a repeated date takes the type of its last row.
 * </p>
 */
public class HolidayWorkbookReader {

	private static final Logger log = LoggerFactory.getLogger(HolidayWorkbookReader.class);

	private static final int DATE_COL = 0;
	private static final int TYPE_COL = 3;

	private final String sheetName;

	/**
	 * Constructor.
	 *
	 * @param sheetName the name of the sheet listing the holidays
	 */
	public HolidayWorkbookReader(String sheetName) {
		super();
		this.sheetName = sheetName;
	}

	/**
	 * Read a holiday calendar.
	 *
	 * @param path the workbook to read
	 * @return the calendar
	 * @throws IOException if the workbook cannot be read or has no holiday sheet
	 */
	public HolidayCalendar read(Path path) throws IOException {
		try (Workbook wb = WorkbookFactory.create(path.toFile(), null, true)) {
			final Sheet sheet = wb.getSheet(sheetName);
			if (sheet == null) {
				throw new IOException("Sheet [%s] not found in %s".formatted(sheetName, path));
			}
			final Map<LocalDate, Integer> holidays = new LinkedHashMap<>();
			final List<String> warnings = new ArrayList<>();
			boolean header = true;
			for (Row row : sheet) {
				if (header) {
					header = false;
					continue;
				}
				final Cell dateCell = WorkbookCells.cell(row, DATE_COL);
				final Cell typeCell = WorkbookCells.cell(row, TYPE_COL);
				if (WorkbookCells.isBlank(dateCell) || WorkbookCells.isBlank(typeCell)) {
					continue;
				}
				final int rowNum = row.getRowNum() + 1;
				try {
					LocalDateTime date = WorkbookCells.dateTime(dateCell);
					Integer type = WorkbookCells.integer(typeCell);
					Integer prev = holidays.put(date.toLocalDate(), type);
					if (prev != null) {
						log.debug("Holiday date {} on row {} replaces type {}", date.toLocalDate(), rowNum, prev);
					}
				} catch (DateTimeException e) {
					warnings.add("%s: row %d has invalid holiday date".formatted(path.getFileName(), rowNum));
				} catch (NumberFormatException e) {
					warnings.add("%s: row %d has invalid holiday type".formatted(path.getFileName(), rowNum));
				}
			}
			return new HolidayCalendar(holidays, warnings);
		} catch (RuntimeException e) {
			throw new IOException("Error reading holiday workbook %s: %s".formatted(path, e.getMessage()), e);
		}
	}

}
