package dpdc.tool.domain;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * A calendar of holiday dates and their types.
 * 
 * @param holidays the holiday type for each holiday date
 * @param warnings warnings for holiday records that could not be read
 */
public record HolidayCalendar(Map<LocalDate, Integer> holidays, List<String> warnings) {

	/**
	 * Constructor.
	 * 
	 * @param holidays the holidays
	 * @param warnings the warnings
	 */
	public HolidayCalendar {
		holidays = (holidays != null ? Map.copyOf(holidays) : Map.of());
		warnings = (warnings != null ? List.copyOf(warnings) : List.of());
	}

	/**
	 * Test if a date is a holiday.
	 * 
	 * @param date the date
	 * @return {@code true} if the date is a holiday
	 */
	public boolean isHoliday(LocalDate date) {
		return holidays.containsKey(date);
	}

	/**
	 * Get the holiday type of a date.
	 * 
	 * @param date the date
	 * @return the holiday type, or {@code 0} if the date is not a holiday
	 */
	public int holidayType(LocalDate date) {
		return holidays.getOrDefault(date, 0);
	}

	/**
	 * Get the number of holidays.
	 * 
	 * @return the holiday count
	 */
	public int size() {
		return holidays.size();
	}

}
