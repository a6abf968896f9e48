package dpdc.tool.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A key-unique mapping of timestamp keys to rows, sharing one schema.
 *
 * <p>
 * Insertion order is preserved so that serializing a table is deterministic.
 * </p>
 */
public final class Table {

	private final Schema schema;
	private final Map<String, Row> rows;

	/**
	 * Constructor.
	 *
	 * @param schema the schema
	 */
	public Table(Schema schema) {
		super();
		if (schema == null) {
			throw new IllegalArgumentException("The schema argument must not be null.");
		}
		this.schema = schema;
		this.rows = new LinkedHashMap<>();
	}

	/**
	 * Create a table from a raw record stream, keeping the first row of any
	 * duplicated key.
	 *
	 * @param schema  the schema of the record values
	 * @param records the records
	 * @return the table
	 * @throws IllegalArgumentException if any record does not match the schema
	 */
	public static Table fromRecords(Schema schema, List<KeyedRow> records) {
		Table t = new Table(schema);
		for (KeyedRow r : records) {
			t.putIfAbsent(r.key(), r.toRow(schema));
		}
		return t;
	}

	/**
	 * Get the schema.
	 *
	 * @return the schema
	 */
	public Schema schema() {
		return schema;
	}

	/**
	 * Add a row for a key not already present.
	 *
	 * @param key the key
	 * @param row the row
	 * @return {@code true} if the row was added, {@code false} if the key was
	 *         already present (the existing row is kept)
	 * @throws IllegalArgumentException if the row's schema differs from this
	 *                                  table's schema
	 */
	public boolean putIfAbsent(String key, Row row) {
		if (!schema.equals(row.schema())) {
			throw new IllegalArgumentException(
					"Row schema %s does not match table schema %s.".formatted(row.schema().columns(), schema.columns()));
		}
		return (rows.putIfAbsent(key, row) == null);
	}

	/**
	 * Get the row for a key.
	 *
	 * @param key the key
	 * @return the row, or {@code null} if not present
	 */
	public Row get(String key) {
		return rows.get(key);
	}

	/**
	 * Test if a key is present.
	 *
	 * @param key the key
	 * @return {@code true} if a row exists for {@code key}
	 */
	public boolean containsKey(String key) {
		return rows.containsKey(key);
	}

	/**
	 * Get the keys, in insertion order.
	 *
	 * @return the keys
	 */
	public Set<String> keys() {
		return Collections.unmodifiableSet(rows.keySet());
	}

	/**
	 * Get the key and row entries, in insertion order.
	 *
	 * @return the entries
	 */
	public Collection<Map.Entry<String, Row>> entries() {
		return Collections.unmodifiableCollection(rows.entrySet());
	}

	/**
	 * Get the number of rows.
	 *
	 * @return the row count
	 */
	public int size() {
		return rows.size();
	}

	/**
	 * Test if the table has no rows.
	 *
	 * @return {@code true} if empty
	 */
	public boolean isEmpty() {
		return rows.isEmpty();
	}

}
