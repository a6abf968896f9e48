package dpdc.tool.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * The field values of one table row, excluding the key.
 *
 * @param schema the schema the values conform to
 * @param values the values, in schema order; empty strings represent absent
 *               data
 */
public record Row(Schema schema, List<String> values) {

	/** The value used when no data is available for a column. */
	public static final String SENTINEL = "";

	/**
	 * Constructor.
	 *
	 * @param schema the schema the values conform to
	 * @param values the values, in schema order
	 * @throws IllegalArgumentException if the number of values does not match the
	 *                                  schema
	 */
	public Row {
		if (schema == null || values == null) {
			throw new IllegalArgumentException("The schema and values arguments must not be null.");
		}
		if (values.size() != schema.size()) {
			throw new IllegalArgumentException("Row has %d values but schema %s requires %d."
					.formatted(values.size(), schema.columns(), schema.size()));
		}
		var copy = new ArrayList<String>(values.size());
		for (String v : values) {
			copy.add(v != null ? v : SENTINEL);
		}
		values = List.copyOf(copy);
	}

	/**
	 * Create a row of all sentinel values.
	 *
	 * @param schema the schema
	 * @return the row
	 */
	public static Row empty(Schema schema) {
		var values = new ArrayList<String>(schema.size());
		for (int i = 0; i < schema.size(); i++) {
			values.add(SENTINEL);
		}
		return new Row(schema, values);
	}

	/**
	 * Get a value by column index.
	 *
	 * @param index the column index
	 * @return the value, never {@code null}
	 */
	public String get(int index) {
		return values.get(index);
	}

	/**
	 * Get a value by column name.
	 *
	 * @param column the column name
	 * @return the value, or {@code null} if the schema does not declare
	 *         {@code column}
	 */
	public String get(String column) {
		int idx = schema.indexOf(column);
		return (idx < 0 ? null : values.get(idx));
	}

	/**
	 * Create a new row with values appended for a wider schema.
	 *
	 * @param wider  the wider schema, which must start with this row's schema
	 * @param extras the values to append
	 * @return the new row
	 */
	public Row extend(Schema wider, String... extras) {
		var all = new ArrayList<String>(values.size() + extras.length);
		all.addAll(values);
		all.addAll(List.of(extras));
		return new Row(wider, all);
	}

}
