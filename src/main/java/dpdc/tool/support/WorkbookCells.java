package dpdc.tool.support;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;

/**
 * Helper utilities for converting spreadsheet cell values.
 */
public final class WorkbookCells {

	private WorkbookCells() {
		// not available
	}

	/**
	 * Get a cell from a row.
	 *
	 * @param row   the row
	 * @param index the 0-based column index
	 * @return the cell, or {@code null} if the row does not define it
	 */
	public static Cell cell(Row row, int index) {
		return (row != null ? row.getCell(index, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL) : null);
	}

	/**
	 * Get the type of a cell's value, resolving formulas to their cached result
	 * type.
	 *
	 * @param cell the cell
	 * @return the type, {@link CellType#BLANK} for {@code null}
	 */
	public static CellType valueType(Cell cell) {
		if (cell == null) {
			return CellType.BLANK;
		}
		CellType type = cell.getCellType();
		return (type == CellType.FORMULA ? cell.getCachedFormulaResultType() : type);
	}

	/**
	 * Test if a cell has no value.
	 *
	 * @param cell the cell
	 * @return {@code true} if the cell is missing, blank, or holds only
	 *         whitespace
	 */
	public static boolean isBlank(Cell cell) {
		CellType type = valueType(cell);
		return type == CellType.BLANK || (type == CellType.STRING && cell.getStringCellValue().isBlank());
	}

	/**
	 * Get a cell's value as a local date and time, rounded to the nearest second.
	 *
	 * <p>
	 * Numeric cells are interpreted as spreadsheet date serial values, and text
	 * cells are parsed with {@link Timestamps#parseLocalDateTime(String)}.
	 * </p>
	 *
	 * @param cell the cell
	 * @return the date time, or {@code null} if the cell is blank
	 * @throws DateTimeException if the cell value is not a date
	 */
	public static LocalDateTime dateTime(Cell cell) {
		if (isBlank(cell)) {
			return null;
		}
		switch (valueType(cell)) {
			case NUMERIC:
				double serial = cell.getNumericCellValue();
				if (!DateUtil.isValidExcelDate(serial)) {
					throw new DateTimeException("Numeric value %s is not a date".formatted(serial));
				}
				return roundToSecond(DateUtil.getLocalDateTime(serial));
			case STRING:
				return roundToSecond(Timestamps.parseLocalDateTime(cell.getStringCellValue()));
			default:
				throw new DateTimeException("Cell type %s is not a date".formatted(valueType(cell)));
		}
	}

	/**
	 * Get a cell's value as a plain decimal string.
	 *
	 * @param cell the cell
	 * @return the decimal string, or an empty string if the cell is blank
	 * @throws NumberFormatException if the cell value is not a number
	 */
	public static String number(Cell cell) {
		if (isBlank(cell)) {
			return "";
		}
		switch (valueType(cell)) {
			case NUMERIC:
				return plain(BigDecimal.valueOf(cell.getNumericCellValue()));
			case STRING:
				return plain(new BigDecimal(cell.getStringCellValue().strip()));
			default:
				throw new NumberFormatException("Cell type %s is not a number".formatted(valueType(cell)));
		}
	}

	/**
	 * Get a cell's value as an integer.
	 *
	 * @param cell the cell
	 * @return the integer, or {@code null} if the cell is blank
	 * @throws NumberFormatException if the cell value is not an integer
	 */
	public static Integer integer(Cell cell) {
		String n = number(cell);
		if (n.isEmpty()) {
			return null;
		}
		try {
			return new BigDecimal(n).intValueExact();
		} catch (ArithmeticException e) {
			throw new NumberFormatException("Value %s is not an integer".formatted(n));
		}
	}

	private static String plain(BigDecimal d) {
		BigDecimal s = d.stripTrailingZeros();
		return (s.scale() < 0 ? s.setScale(0) : s).toPlainString();
	}

	private static LocalDateTime roundToSecond(LocalDateTime t) {
		return t.plusNanos(500_000_000L).truncatedTo(ChronoUnit.SECONDS);
	}

}
