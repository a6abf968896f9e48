package dpdc.tool.support.test;

import static dpdc.tool.test.TestFixtures.text;
import static org.assertj.core.api.BDDAssertions.then;

import java.io.IOException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dpdc.tool.domain.Table;
import dpdc.tool.support.CsvTables;
import dpdc.tool.support.CsvTables.CsvContent;

/**
 * Test cases for the {@link CsvTables} class.
 */
public class CsvTablesTests {

	@TempDir
	Path dir;

	@Test
	public void read() throws IOException {
		// GIVEN
		// @formatter:off
		Path file = text(dir.resolve("t.csv")
				, "date_time,load,forecasted_load"
				, "2024-01-01 00:00:00+06:00,1,2"
				, "2024-01-01 01:00:00+06:00,,4"
				, "2024-01-01 02:00:00+06:00,5"
				, ",6,7"
				, "2024-01-01 00:00:00+06:00,8,9"
			);
		// @formatter:on

		// WHEN
		CsvContent content = CsvTables.read(file);
		Table table = content.toTable();

		// THEN
		then(content.schema().columns()).containsExactly("load", "forecasted_load");
		then(content.records().rows()).as("Valid rows").hasSize(3);
		then(content.records().warnings()).as("Short row and blank key reported").hasSize(2)
				.allSatisfy(w -> then(w).startsWith("t.csv: line"));
		then(table.size()).as("Repeated key collapsed").isEqualTo(2);
		then(table.get("2024-01-01 00:00:00+06:00").values()).containsExactly("1", "2");
		then(table.get("2024-01-01 01:00:00+06:00").values()).as("Empty value").containsExactly("", "4");
	}

	@Test
	public void readKeys() throws IOException {
		// GIVEN
		// @formatter:off
		Path file = text(dir.resolve("t.csv")
				, "date_time,load"
				, "b,1"
				, "a,2"
				, "b,3"
			);
		// @formatter:on

		// WHEN
		var keys = CsvTables.readKeys(file);

		// THEN
		then(keys).as("Raw keys in row order").containsExactly("b", "a", "b");
	}

}
