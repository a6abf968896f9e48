package dpdc.tool.support;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.supercsv.prefs.CsvPreference.STANDARD_PREFERENCE;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.supercsv.io.CsvListReader;
import org.supercsv.io.ICsvListReader;

import dpdc.tool.domain.KeyedRow;
import dpdc.tool.domain.RecordResult;
import dpdc.tool.domain.Schema;
import dpdc.tool.domain.SourceReadResult;
import dpdc.tool.domain.Table;

/**
 * Helper utilities for reading table files.
 *
 * <p>
 * A table file is CSV with a header row; the first column holds the timestamp
 * key.
 * </p>
 */
public final class CsvTables {

	private CsvTables() {
		// not available
	}

	/**
	 * The content of a table file.
	 *
	 * @param schema  the schema declared by the header, excluding the key column
	 * @param records the records, in file order and including duplicate keys
	 */
	public record CsvContent(Schema schema, SourceReadResult records) {

		/**
		 * Get a key-unique table of the records, keeping the first row of any
		 * duplicated key.
		 *
		 * @return the table
		 */
		public Table toTable() {
			return Table.fromRecords(schema, records.rows());
		}

	}

	/**
	 * Read a table file.
	 *
	 * <p>
	 * Rows whose column count does not match the header are skipped with a
	 * warning.
	 * </p>
	 *
	 * @param path the file to read
	 * @return the content
	 * @throws IOException              if any IO error occurs, or the file has no
	 *                                  header
	 * @throws IllegalArgumentException if the header is not a valid schema
	 */
	public static CsvContent read(Path path) throws IOException {
		try (ICsvListReader csv = new CsvListReader(Files.newBufferedReader(path, UTF_8), STANDARD_PREFERENCE)) {
			final String[] header = csv.getHeader(true);
			if (header == null || header.length < 1) {
				throw new IOException("No header row in " + path);
			}
			final Schema schema = new Schema(Arrays.asList(header).subList(1, header.length));
			final String source = String.valueOf(path.getFileName());
			final List<RecordResult> results = new ArrayList<>();
			List<String> row;
			while ((row = csv.read()) != null) {
				results.add(record(row, header.length, csv.getLineNumber()));
			}
			return new CsvContent(schema, SourceReadResult.of(source, results, 0));
		}
	}

	/**
	 * Read the key column of a table file.
	 *
	 * @param path the file to read
	 * @return the keys, in file order and including duplicates; blank keys are
	 *         returned as empty strings
	 * @throws IOException if any IO error occurs
	 */
	public static List<String> readKeys(Path path) throws IOException {
		try (ICsvListReader csv = new CsvListReader(Files.newBufferedReader(path, UTF_8), STANDARD_PREFERENCE)) {
			if (csv.getHeader(true) == null) {
				return List.of();
			}
			final List<String> keys = new ArrayList<>();
			List<String> row;
			while ((row = csv.read()) != null) {
				String key = row.get(0);
				keys.add(key != null ? key : "");
			}
			return keys;
		}
	}

	private static RecordResult record(List<String> row, int width, int lineNumber) {
		if (row.size() != width) {
			return RecordResult.skipped("line %d has %d columns but header has %d".formatted(lineNumber, row.size(),
					width));
		}
		final String key = row.get(0);
		if (key == null || key.isBlank()) {
			return RecordResult.skipped("line %d has no timestamp".formatted(lineNumber));
		}
		return RecordResult.parsed(new KeyedRow(key, row.subList(1, row.size())));
	}

}
