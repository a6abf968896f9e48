package dpdc.tool.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A raw record read from a source, before any key de-duplication.
 *
 * @param key    the canonical timestamp key
 * @param values the field values, in source column order
 */
public record KeyedRow(String key, List<String> values) {

	/**
	 * Constructor.
	 *
	 * @param key    the canonical timestamp key
	 * @param values the field values
	 */
	public KeyedRow {
		if (key == null) {
			throw new IllegalArgumentException("The key argument must not be null.");
		}
		if (values == null) {
			values = List.of();
		} else {
			var copy = new ArrayList<String>(values.size());
			for (String v : values) {
				copy.add(v != null ? v : Row.SENTINEL);
			}
			values = Collections.unmodifiableList(copy);
		}
	}

	/**
	 * Convert to a table row.
	 *
	 * @param schema the schema of the values
	 * @return the row
	 * @throws IllegalArgumentException if the values do not match the schema
	 */
	public Row toRow(Schema schema) {
		return new Row(schema, values);
	}

}
