package dpdc.tool.pipeline;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import dpdc.tool.config.MigrationSettings;
import dpdc.tool.domain.KeyedRow;
import dpdc.tool.domain.Schema;
import dpdc.tool.domain.StageDescriptor;
import dpdc.tool.domain.Table;
import dpdc.tool.support.CsvTables.CsvContent;
import dpdc.tool.support.Timestamps;

/**
 * Base class for migration stages.
 */
public abstract class AbstractStage implements Stage {

	/** The run settings. */
	protected final MigrationSettings settings;

	private final StageDescriptor descriptor;

	/**
	 * Constructor.
	 * 
	 * @param settings   the run settings
	 * @param descriptor the stage descriptor
	 */
	protected AbstractStage(MigrationSettings settings, StageDescriptor descriptor) {
		super();
		this.settings = settings;
		this.descriptor = descriptor;
	}

	@Override
	public final StageDescriptor descriptor() {
		return descriptor;
	}

	/**
	 * Build a table from CSV content with every key rendered in canonical form.
	 * 
	 * <p>
	 * Keys are parsed, shifted to the configured offset and re-rendered. Rows
	 * with unparseable keys are skipped and rows whose canonical key repeats an
	 * earlier one are dropped; both are reported as warnings. The resulting rows
	 * are ordered by key.
	 * </p>
	 * 
	 * @param content  the CSV content
	 * @param source   the source name for warnings
	 * @param warnings the list to add warnings to
	 * @return the table
	 */
	protected Table canonicalTable(CsvContent content, String source, List<String> warnings) {
		warnings.addAll(content.records().warnings());
		final List<KeyedRow> rows = canonicalRows(content.records().rows(), source, warnings);
		return table(content.schema(), rows, source, warnings);
	}

	/**
	 * Re-key rows in canonical form and sort them by key.
	 * 
	 * @param rows     the rows
	 * @param source   the source name for warnings
	 * @param warnings the list to add warnings to
	 * @return the re-keyed rows, sorted
	 */
	protected List<KeyedRow> canonicalRows(List<KeyedRow> rows, String source, List<String> warnings) {
		final List<KeyedRow> result = new ArrayList<>(rows.size());
		int invalid = 0;
		for (KeyedRow row : rows) {
			final OffsetDateTime ts;
			try {
				ts = canonicalTimestamp(row.key());
			} catch (DateTimeParseException e) {
				if (invalid++ < 10) {
					warnings.add("%s: invalid timestamp [%s] skipped".formatted(source, row.key()));
				}
				continue;
			}
			result.add(new KeyedRow(Timestamps.key(ts), row.values()));
		}
		if (invalid > 10) {
			warnings.add("%s: %d more invalid timestamps skipped".formatted(source, invalid - 10));
		}
		result.sort(Comparator.comparing(KeyedRow::key));
		return result;
	}

	/**
	 * Parse a key and shift it to the configured offset.
	 * 
	 * @param key the key
	 * @return the timestamp
	 * @throws DateTimeParseException if the key cannot be parsed
	 */
	protected OffsetDateTime canonicalTimestamp(String key) {
		return Timestamps.parseKey(key, settings.zoneOffset()).withOffsetSameInstant(settings.zoneOffset());
	}

	/**
	 * Create a table from sorted rows, keeping the first row of each key.
	 * 
	 * @param schema   the schema
	 * @param rows     the rows, sorted by key
	 * @param source   the source name for warnings
	 * @param warnings the list to add warnings to
	 * @return the table
	 */
	protected static Table table(Schema schema, List<KeyedRow> rows, String source, List<String> warnings) {
		final Table table = Table.fromRecords(schema, rows);
		final int dropped = rows.size() - table.size();
		if (dropped > 0) {
			warnings.add("%s: %d duplicate timestamps ignored".formatted(source, dropped));
		}
		return table;
	}

	/**
	 * Get a display name for a path.
	 * 
	 * @param path the path
	 * @return the file name
	 */
	protected static String name(Path path) {
		return String.valueOf(path.getFileName());
	}

}
