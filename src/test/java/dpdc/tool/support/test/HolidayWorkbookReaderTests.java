package dpdc.tool.support.test;

import static dpdc.tool.test.TestFixtures.workbook;
import static org.assertj.core.api.BDDAssertions.then;
import static org.assertj.core.api.BDDAssertions.thenThrownBy;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dpdc.tool.domain.HolidayCalendar;
import dpdc.tool.support.HolidayWorkbookReader;

/**
 * Test cases for the {@link HolidayWorkbookReader} class.
 */
public class HolidayWorkbookReaderTests {

	@TempDir
	Path dir;

	private final HolidayWorkbookReader reader = new HolidayWorkbookReader("List of Holidays");

	@Test
	public void read() throws IOException {
		// GIVEN
		Path wb = dir.resolve("holidays.xlsx");
		// @formatter:off
		workbook(wb, "List of Holidays", List.of(
				  new Object[] { "Date", "Name", "Day", "Type" }
				, new Object[] { LocalDate.parse("2024-02-21"), "Language Day", "Wednesday", 1 }
				, new Object[] { LocalDate.parse("2024-03-26"), "Independence Day", "Tuesday", 2 }
				, new Object[] { LocalDate.parse("2024-04-01"), "No type", "Monday", null }
				, new Object[] { "16/12/2024", "Victory Day", "Monday", 1 }
				, new Object[] { LocalDate.parse("2024-02-21"), "Repeated", "Wednesday", 3 }
				, new Object[] { LocalDate.parse("2024-05-01"), "Bad type", "Wednesday", "x" }
			));
		// @formatter:on

		// WHEN
		HolidayCalendar result = reader.read(wb);

		// THEN
		then(result.size()).isEqualTo(3);
		then(result.holidayType(LocalDate.parse("2024-02-21"))).as("Last repeated date wins").isEqualTo(3);
		then(result.holidayType(LocalDate.parse("2024-03-26"))).isEqualTo(2);
		then(result.isHoliday(LocalDate.parse("2024-12-16"))).as("Text date parsed").isTrue();
		then(result.isHoliday(LocalDate.parse("2024-04-01"))).as("Row without type skipped").isFalse();
		then(result.holidayType(LocalDate.parse("2024-01-01"))).as("Not a holiday").isEqualTo(0);
		then(result.warnings()).as("Invalid type reported").hasSize(1);
	}

	@Test
	public void read_missingSheet() throws IOException {
		// GIVEN
		Path wb = dir.resolve("holidays.xlsx");
		workbook(wb, "Other", List.<Object[]>of(new Object[] { "Date" }));

		// THEN
		thenThrownBy(() -> reader.read(wb)).isInstanceOf(IOException.class).hasMessageContaining("List of Holidays");
	}

}
