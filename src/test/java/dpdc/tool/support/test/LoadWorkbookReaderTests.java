package dpdc.tool.support.test;

import static dpdc.tool.test.TestFixtures.loadWorkbook;
import static org.assertj.core.api.BDDAssertions.then;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dpdc.tool.domain.KeyedRow;
import dpdc.tool.domain.SourceReadResult;
import dpdc.tool.support.LoadWorkbookReader;

/**
 * Test cases for the {@link LoadWorkbookReader} class.
 */
public class LoadWorkbookReaderTests {

	@TempDir
	Path dir;

	private final LoadWorkbookReader reader = new LoadWorkbookReader(ZoneOffset.ofHours(6), Duration.ofHours(1));

	@Test
	public void listWorkbooks() throws IOException {
		// GIVEN
		for (String name : List.of("b.xlsx", "a.xlsx", "sub/c.XLSX", "All_Data_2024.xlsx", "notes.txt")) {
			Path p = dir.resolve(name);
			Files.createDirectories(p.getParent());
			Files.createFile(p);
		}

		// WHEN
		List<Path> result = LoadWorkbookReader.listWorkbooks(dir, "all_data");

		// THEN
		then(result).as("Sorted, recursive, excluded fragment ignored").containsExactly(dir.resolve("a.xlsx"),
				dir.resolve("b.xlsx"), dir.resolve("sub/c.XLSX"));
	}

	@Test
	public void read() throws IOException {
		// GIVEN
		Path wb = dir.resolve("load.xlsx");
		// @formatter:off
		loadWorkbook(wb, List.of(
				  new Object[] { LocalDateTime.parse("2024-01-01T00:00"), 100.5, 110 }
				, new Object[] { LocalDateTime.parse("2024-01-01T00:30"), 50, 60 }
				, new Object[] { "not a date", 1, 1 }
				, new Object[] { LocalDateTime.parse("2024-01-01T01:00"), "abc", 1 }
				, new Object[] { "2024-01-01 02:00:00", null, 5 }
				, new Object[] { null, null, null }
			));
		// @formatter:on

		// WHEN
		SourceReadResult result = reader.read(wb);

		// THEN
		// @formatter:off
		then(result.rows())
			.as("Valid aligned rows")
			.containsExactly(
					  new KeyedRow("2024-01-01 00:00:00+06:00", List.of("100.5", "110"))
					, new KeyedRow("2024-01-01 02:00:00+06:00", List.of("", "5"))
			)
			;
		// @formatter:on
		then(result.filtered()).as("Off-grid row filtered").isEqualTo(1);
		then(result.warnings()).as("Invalid timestamp and non-numeric load reported").hasSize(2)
				.allSatisfy(w -> then(w).startsWith("load.xlsx: row"));
	}

	@Test
	public void read_unreadable() throws IOException {
		// GIVEN
		Path wb = Files.writeString(dir.resolve("broken.xlsx"), "this is not a workbook");

		// WHEN
		SourceReadResult result = reader.read(wb);

		// THEN
		then(result.rows()).isEmpty();
		then(result.warnings()).hasSize(1).first().asString().startsWith("broken.xlsx: unreadable workbook");
	}

}
