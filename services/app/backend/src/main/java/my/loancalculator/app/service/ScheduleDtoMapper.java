package my.loancalculator.app.service;

import my.loancalculator.app.dto.ScheduleEntryDto;
import my.loancalculator.app.dto.ScheduleSummaryDto;
import my.loancalculator.app.model.ScheduleEntry;
import my.loancalculator.app.model.ScheduleSummary;
import my.loancalculator.app.util.MonthCalendar;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Converts engine results to their wire form. Money is rounded to cents, the rate to eight decimals.
 */
@Component
public class ScheduleDtoMapper {
	private static final int MONEY_SCALE = 2;
	private static final int RATE_SCALE = 8;

	public ScheduleSummaryDto toSummaryDto(ScheduleSummary summary) {
		return new ScheduleSummaryDto(
				money(summary.principalFinanced()),
				money(summary.totalInterest()),
				money(summary.totalOverpayment()),
				money(summary.totalCost()),
				summary.apr().setScale(RATE_SCALE, RoundingMode.HALF_UP),
				summary.termMonths(),
				MonthCalendar.format(summary.originalEndDate()),
				MonthCalendar.format(summary.newEndDate()),
				summary.paymentsMade(),
				money(summary.maxPayment())
		);
	}

	public ScheduleEntryDto toEntryDto(ScheduleEntry entry) {
		return new ScheduleEntryDto(
				entry.periodIndex(),
				MonthCalendar.format(entry.month()),
				money(entry.startingBalance()),
				money(entry.payment()),
				money(entry.principalComponent()),
				money(entry.interestComponent()),
				money(entry.overpaymentAmount()),
				money(entry.endingBalance()),
				money(entry.trancheDisbursedAmount()),
				entry.holiday()
		);
	}

	public List<ScheduleEntryDto> toEntryDtos(List<ScheduleEntry> entries) {
		return entries.stream().map(this::toEntryDto).toList();
	}

	static BigDecimal money(BigDecimal value) {
		return value == null ? null : value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
	}
}
