package my.loancalculator.app.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonthCalendarTest {
	@Test
	void addMonthsClampsDayOfMonth() {
		assertThat(MonthCalendar.addMonths(LocalDate.of(2024, 1, 31), 1)).isEqualTo(LocalDate.of(2024, 2, 29));
		assertThat(MonthCalendar.addMonths(LocalDate.of(2023, 1, 31), 1)).isEqualTo(LocalDate.of(2023, 2, 28));
		assertThat(MonthCalendar.addMonths(LocalDate.of(2024, 3, 31), -1)).isEqualTo(LocalDate.of(2024, 2, 29));
	}

	@Test
	void addMonthsCrossesYearBoundary() {
		assertThat(MonthCalendar.addMonths(LocalDate.of(2024, 11, 15), 3)).isEqualTo(LocalDate.of(2025, 2, 15));
		assertThat(MonthCalendar.addMonths(YearMonth.of(2024, 12), 1)).isEqualTo(YearMonth.of(2025, 1));
	}

	@Test
	void firstOfMonthNormalizesDay() {
		assertThat(MonthCalendar.firstOfMonth(LocalDate.of(2024, 5, 17))).isEqualTo(LocalDate.of(2024, 5, 1));
		assertThat(MonthCalendar.firstOfMonth(null)).isNull();
	}

	@Test
	void parsesYearMonthWithOptionalDay() {
		assertThat(MonthCalendar.parseYearMonth("2024-03")).isEqualTo(YearMonth.of(2024, 3));
		assertThat(MonthCalendar.parseYearMonth(" 2024-3 ")).isEqualTo(YearMonth.of(2024, 3));
		assertThat(MonthCalendar.parseYearMonth("2024-03-15")).isEqualTo(YearMonth.of(2024, 3));
	}

	@Test
	void rejectsMalformedYearMonth() {
		assertThatThrownBy(() -> MonthCalendar.parseYearMonth("2024-13")).isInstanceOf(DateTimeParseException.class);
		assertThatThrownBy(() -> MonthCalendar.parseYearMonth("03/2024")).isInstanceOf(DateTimeParseException.class);
		assertThatThrownBy(() -> MonthCalendar.parseYearMonth(null)).isInstanceOf(DateTimeParseException.class);
	}

	@Test
	void formatsAsYearDashMonth() {
		assertThat(MonthCalendar.format(YearMonth.of(2024, 3))).isEqualTo("2024-03");
	}
}
