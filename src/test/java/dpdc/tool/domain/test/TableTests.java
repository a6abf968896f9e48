package dpdc.tool.domain.test;

import static org.assertj.core.api.BDDAssertions.then;
import static org.assertj.core.api.BDDAssertions.thenThrownBy;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import dpdc.tool.domain.KeyedRow;
import dpdc.tool.domain.Row;
import dpdc.tool.domain.Schema;
import dpdc.tool.domain.Table;

/**
 * Test cases for the {@link Table}, {@link Schema} and {@link Row} classes.
 */
public class TableTests {

	private static final Schema SCHEMA = Schema.of("load", "forecasted_load");

	@Test
	public void schema_header() {
		then(SCHEMA.header()).as("Key column first").containsExactly("date_time", "load", "forecasted_load");
	}

	@Test
	public void schema_duplicateColumn() {
		thenThrownBy(() -> Schema.of("load", "load")).as("Duplicate column rejected")
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	public void schema_keyColumn() {
		thenThrownBy(() -> Schema.of("date_time", "load")).as("Key column is implicit")
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	public void schema_with() {
		// WHEN
		Schema result = SCHEMA.with("is_holiday");

		// THEN
		then(result.columns()).containsExactly("load", "forecasted_load", "is_holiday");
		then(SCHEMA.size()).as("Original unchanged").isEqualTo(2);
	}

	@Test
	public void row_arity() {
		thenThrownBy(() -> new Row(SCHEMA, List.of("1"))).as("Value count must match schema")
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	public void row_nullsAsSentinel() {
		// WHEN
		Row row = new Row(SCHEMA, Arrays.asList("1", null));

		// THEN
		then(row.values()).containsExactly("1", Row.SENTINEL);
		then(row.get("forecasted_load")).isEqualTo("");
		then(row.get("nope")).as("Undeclared column").isNull();
	}

	@Test
	public void row_extend() {
		// GIVEN
		Row row = new Row(SCHEMA, List.of("1", "2"));
		Schema wider = SCHEMA.with("is_holiday");

		// WHEN
		Row result = row.extend(wider, "0");

		// THEN
		then(result.schema()).isEqualTo(wider);
		then(result.get("is_holiday")).isEqualTo("0");
	}

	@Test
	public void table_keepFirst() {
		// GIVEN
		// @formatter:off
		List<KeyedRow> records = List.of(
				  new KeyedRow("2024-01-01 00:00:00+06:00", List.of("1", "2"))
				, new KeyedRow("2024-01-01 01:00:00+06:00", List.of("3", "4"))
				, new KeyedRow("2024-01-01 00:00:00+06:00", List.of("5", "6"))
			);
		// @formatter:on

		// WHEN
		Table table = Table.fromRecords(SCHEMA, records);

		// THEN
		then(table.size()).as("Duplicate key collapsed").isEqualTo(2);
		then(table.get("2024-01-01 00:00:00+06:00").values()).as("First row kept").containsExactly("1", "2");
		then(table.keys()).as("Insertion order").containsExactly("2024-01-01 00:00:00+06:00",
				"2024-01-01 01:00:00+06:00");
	}

	@Test
	public void table_schemaMismatch() {
		// GIVEN
		Table table = new Table(SCHEMA);

		// THEN
		thenThrownBy(() -> table.putIfAbsent("k", Row.empty(Schema.of("load"))))
				.isInstanceOf(IllegalArgumentException.class);
	}

}
