package my.loancalculator.app.model;

import my.loancalculator.app.util.MonthCalendar;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ScheduleSummary(BigDecimal principalFinanced,
							  BigDecimal totalInterest,
							  BigDecimal totalOverpayment,
							  BigDecimal totalCost,
							  BigDecimal apr,
							  int termMonths,
							  YearMonth originalEndDate,
							  YearMonth newEndDate,
							  int paymentsMade,
							  BigDecimal maxPayment) {
	public static final String PRINCIPAL_FINANCED = "principal_financed";
	public static final String TOTAL_INTEREST = "total_interest";
	public static final String TOTAL_OVERPAYMENT = "total_overpayment";
	public static final String TOTAL_COST = "total_cost";
	public static final String APR = "apr";
	public static final String TERM_MONTHS = "term_months";
	public static final String ORIGINAL_END_DATE = "original_end_date";
	public static final String NEW_END_DATE = "new_end_date";
	public static final String PAYMENTS_MADE = "payments_made";
	public static final String MAX_PAYMENT = "max_payment";

	/**
	 * Summary keyed the way export and rendering collaborators consume it; dates are {@code YYYY-MM} strings.
	 */
	public Map<String, Object> toMap() {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put(PRINCIPAL_FINANCED, principalFinanced);
		map.put(TOTAL_INTEREST, totalInterest);
		map.put(TOTAL_OVERPAYMENT, totalOverpayment);
		map.put(TOTAL_COST, totalCost);
		map.put(APR, apr);
		map.put(TERM_MONTHS, termMonths);
		map.put(ORIGINAL_END_DATE, MonthCalendar.format(originalEndDate));
		map.put(NEW_END_DATE, MonthCalendar.format(newEndDate));
		map.put(PAYMENTS_MADE, paymentsMade);
		map.put(MAX_PAYMENT, maxPayment);
		return Collections.unmodifiableMap(map);
	}
}
