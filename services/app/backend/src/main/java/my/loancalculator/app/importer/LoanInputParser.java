package my.loancalculator.app.importer;

import my.loancalculator.app.dto.LoanScheduleRequest;
import my.loancalculator.app.model.LoanConfiguration;
import my.loancalculator.app.model.LoanType;
import my.loancalculator.app.model.Overpayment;
import my.loancalculator.app.model.OverpaymentKind;
import my.loancalculator.app.model.Tranche;
import my.loancalculator.app.util.MonthCalendar;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns the textual loan input used by the API and saved scenarios into a validated {@link LoanConfiguration}.
 */
public class LoanInputParser {
	private static final BigDecimal THOUSAND = new BigDecimal("1000");
	private static final BigDecimal MILLION = new BigDecimal("1000000");
	private static final BigDecimal HUNDRED = new BigDecimal("100");

	public LoanConfiguration parse(LoanScheduleRequest request) {
		if (request == null) {
			throw new IllegalArgumentException("Loan input is required");
		}
		if (request.term() == null) {
			throw new LoanInputParseException("term", null, "Term is required");
		}
		int term = request.term();
		if (term > LoanConfiguration.MAX_TERM) {
			throw new LoanInputParseException("term", String.valueOf(term),
					"Term must not exceed " + LoanConfiguration.MAX_TERM + " months");
		}
		YearMonth start = parseYearMonth("start_date", request.startDate());

		List<Overpayment> overpayments = new ArrayList<>();
		for (String raw : nonBlank(request.overpayments())) {
			overpayments.add(parseOverpayment(raw));
		}
		if (!isBlank(request.monthlyOverpayment())) {
			overpayments.addAll(expandMonthlyOverpayment(request.monthlyOverpayment(), start, term));
		}

		List<Tranche> tranches = new ArrayList<>();
		for (String raw : nonBlank(request.tranches())) {
			tranches.add(parseTranche(raw));
		}
		Set<YearMonth> holidays = new LinkedHashSet<>();
		for (String raw : nonBlank(request.holidays())) {
			holidays.add(parseYearMonth("holidays", raw));
		}

		return LoanConfiguration.builder()
				.principal(parseAmount("principal", request.principal()))
				.downPayment(isBlank(request.downPayment()) ? BigDecimal.ZERO
						: parseAmount("down_payment", request.downPayment()))
				.rate(request.rate())
				.term(term)
				.startMonth(start)
				.loanType(parseLoanType(request.loanType()))
				.tranches(tranches)
				.overpayments(overpayments)
				.holidays(holidays)
				.targetPayment(isBlank(request.constantPayment()) ? null
						: parseAmount("constant_payment", request.constantPayment()))
				.build();
	}

	/**
	 * Reads an amount such as {@code 250000}, {@code 1,250.50}, {@code 500k} or {@code 1.2m}.
	 */
	public BigDecimal parseAmount(String field, String raw) {
		String value = trim(raw).toLowerCase(Locale.ROOT).replace(",", "");
		BigDecimal factor = BigDecimal.ONE;
		if (value.endsWith("k")) {
			factor = THOUSAND;
			value = value.substring(0, value.length() - 1);
		} else if (value.endsWith("m")) {
			factor = MILLION;
			value = value.substring(0, value.length() - 1);
		}
		try {
			return new BigDecimal(value.trim()).multiply(factor);
		} catch (NumberFormatException exc) {
			throw new LoanInputParseException(field, raw, "Invalid amount: " + trim(raw), exc);
		}
	}

	/**
	 * Reads a fraction. {@code 0.8}, {@code 80} and {@code 80%} all yield {@code 0.8}.
	 */
	public BigDecimal parsePercent(String field, String raw) {
		String value = trim(raw);
		if (value.endsWith("%")) {
			value = value.substring(0, value.length() - 1).trim();
		}
		BigDecimal percent;
		try {
			percent = new BigDecimal(value);
		} catch (NumberFormatException exc) {
			throw new LoanInputParseException(field, raw, "Invalid percentage: " + trim(raw), exc);
		}
		if (percent.compareTo(BigDecimal.ONE) > 0) {
			percent = percent.divide(HUNDRED);
		}
		return percent;
	}

	public YearMonth parseYearMonth(String field, String raw) {
		try {
			return MonthCalendar.parseYearMonth(raw);
		} catch (DateTimeParseException exc) {
			throw new LoanInputParseException(field, raw, "Invalid month, expected YYYY-MM: " + trim(raw), exc);
		}
	}

	public Tranche parseTranche(String raw) {
		String[] parts = trim(raw).split(":");
		if (parts.length != 2) {
			throw new LoanInputParseException("tranches", raw, "Tranche must be in YYYY-MM:PERCENT format; got " + raw);
		}
		return new Tranche(parseYearMonth("tranches", parts[0]), parsePercent("tranches", parts[1]));
	}

	public Overpayment parseOverpayment(String raw) {
		String[] parts = trim(raw).split(":");
		if (parts.length != 3) {
			throw new LoanInputParseException("overpayments", raw,
					"Overpayment must be in YYYY-MM:AMOUNT:TYPE format; got " + raw);
		}
		return new Overpayment(
				parseYearMonth("overpayments", parts[0]),
				parseAmount("overpayments", parts[1]),
				parseOverpaymentKind("overpayments", parts[2]));
	}

	/**
	 * Expands {@code AMOUNT:TYPE} into one overpayment per month for {@code term} months from {@code start}.
	 */
	public List<Overpayment> expandMonthlyOverpayment(String raw, YearMonth start, int term) {
		String[] parts = trim(raw).split(":");
		if (parts.length != 2) {
			throw new LoanInputParseException("monthly_overpayment", raw,
					"Monthly overpayment must be in AMOUNT:TYPE format, e.g. 500:term");
		}
		BigDecimal amount = parseAmount("monthly_overpayment", parts[0]);
		OverpaymentKind kind = parseOverpaymentKind("monthly_overpayment", parts[1]);
		List<Overpayment> expanded = new ArrayList<>(Math.max(term, 0));
		for (int i = 0; i < term; i++) {
			expanded.add(new Overpayment(MonthCalendar.addMonths(start, i), amount, kind));
		}
		return expanded;
	}

	public LoanType parseLoanType(String raw) {
		if (isBlank(raw)) {
			return LoanType.ANNUITY;
		}
		try {
			return LoanType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException exc) {
			throw new LoanInputParseException("loan_type", raw, "Loan type must be 'annuity' or 'decreasing'; got " + raw, exc);
		}
	}

	private OverpaymentKind parseOverpaymentKind(String field, String raw) {
		try {
			return OverpaymentKind.valueOf(trim(raw).toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException exc) {
			throw new LoanInputParseException(field, raw,
					"Overpayment type must be 'term' or 'installment'; got " + trim(raw), exc);
		}
	}

	private List<String> nonBlank(List<String> values) {
		if (values == null) {
			return List.of();
		}
		return values.stream().filter(value -> !isBlank(value)).map(String::trim).toList();
	}

	private boolean isBlank(String value) {
		return value == null || value.isBlank();
	}

	private String trim(String value) {
		return value == null ? "" : value.trim();
	}
}
