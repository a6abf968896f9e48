package dpdc.tool.domain;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * An ordered list of column names, excluding the timestamp key column.
 *
 * @param columns the column names, in order
 */
public record Schema(List<String> columns) {

	/** The name of the key column, always the first column of a table file. */
	public static final String KEY_COLUMN = "date_time";

	/** The canonical output schema of the migrated time series. */
	// @formatter:off
	public static final Schema CANONICAL = Schema.of(
			  "load"
			, "is_holiday"
			, "holiday_type"
			, "national_event_type"
			, "temp"
			, "dwpt"
			, "rhum"
			, "prcp"
			, "wdir"
			, "wspd"
			, "pres"
			, "coco"
			, "forecasted_load"
		);
	// @formatter:on

	/**
	 * Constructor.
	 *
	 * @param columns the column names, in order
	 * @throws IllegalArgumentException if {@code columns} contains the key
	 *                                  column, a blank name, or a duplicate name
	 */
	public Schema {
		if (columns == null) {
			throw new IllegalArgumentException("The columns argument must not be null.");
		}
		var seen = new HashSet<String>(columns.size());
		for (String col : columns) {
			if (col == null || col.isBlank()) {
				throw new IllegalArgumentException("Column names must not be blank.");
			}
			if (KEY_COLUMN.equals(col)) {
				throw new IllegalArgumentException("The key column [%s] is implicit.".formatted(KEY_COLUMN));
			}
			if (!seen.add(col)) {
				throw new IllegalArgumentException("Duplicate column [%s].".formatted(col));
			}
		}
		columns = List.copyOf(columns);
	}

	/**
	 * Create a schema from column names.
	 *
	 * @param columns the column names
	 * @return the schema
	 */
	public static Schema of(String... columns) {
		return new Schema(List.of(columns));
	}

	/**
	 * Get the number of columns.
	 *
	 * @return the column count
	 */
	public int size() {
		return columns.size();
	}

	/**
	 * Get the index of a column.
	 *
	 * @param column the column name
	 * @return the index, or {@code -1} if not found
	 */
	public int indexOf(String column) {
		return columns.indexOf(column);
	}

	/**
	 * Test if a column is part of this schema.
	 *
	 * @param column the column name
	 * @return {@code true} if the column is declared
	 */
	public boolean contains(String column) {
		return columns.contains(column);
	}

	/**
	 * Create a new schema with additional columns appended.
	 *
	 * @param extra the columns to append
	 * @return the new schema
	 */
	public Schema with(String... extra) {
		var all = new ArrayList<String>(columns.size() + extra.length);
		all.addAll(columns);
		all.addAll(List.of(extra));
		return new Schema(all);
	}

	/**
	 * Get the full header of a table file, with the key column first.
	 *
	 * @return the header names
	 */
	public List<String> header() {
		var header = new ArrayList<String>(columns.size() + 1);
		header.add(KEY_COLUMN);
		header.addAll(columns);
		return header;
	}

}
