package my.loancalculator.app.util;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Month-granularity date arithmetic shared by the schedule engine and its input/output collaborators.
 */
public final class MonthCalendar {
	private static final Pattern YEAR_MONTH_RE = Pattern.compile("^(\\d{4})-(\\d{1,2})(?:-\\d{1,2})?$");
	private static final DateTimeFormatter YEAR_MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

	private MonthCalendar() {
	}

	/**
	 * Advances {@code date} by {@code months} calendar months. The day of month is clamped to the last valid day of
	 * the target month, so Jan 31 + 1 month is Feb 28 (or 29). Negative values move backwards.
	 */
	public static LocalDate addMonths(LocalDate date, int months) {
		if (date == null) {
			throw new IllegalArgumentException("date must not be null");
		}
		YearMonth target = YearMonth.from(date).plusMonths(months);
		int day = Math.min(date.getDayOfMonth(), target.lengthOfMonth());
		return target.atDay(day);
	}

	public static YearMonth addMonths(YearMonth month, int months) {
		if (month == null) {
			throw new IllegalArgumentException("month must not be null");
		}
		return month.plusMonths(months);
	}

	public static LocalDate firstOfMonth(LocalDate date) {
		if (date == null) {
			return null;
		}
		return date.withDayOfMonth(1);
	}

	/**
	 * Parses {@code YYYY-MM}. A trailing day component ({@code YYYY-MM-DD}) is accepted and ignored.
	 *
	 * @throws DateTimeParseException if the value is not a valid year-month
	 */
	public static YearMonth parseYearMonth(String value) {
		String trimmed = value == null ? "" : value.trim();
		Matcher matcher = YEAR_MONTH_RE.matcher(trimmed);
		if (!matcher.matches()) {
			throw new DateTimeParseException("Invalid year-month: " + trimmed, trimmed, 0);
		}
		int year = Integer.parseInt(matcher.group(1));
		int month = Integer.parseInt(matcher.group(2));
		if (month < 1 || month > 12) {
			throw new DateTimeParseException("Invalid month in year-month: " + trimmed, trimmed, 5);
		}
		return YearMonth.of(year, month);
	}

	public static String format(YearMonth month) {
		return month == null ? null : month.format(YEAR_MONTH_FORMAT);
	}
}
