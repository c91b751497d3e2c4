package my.loancalculator.app.schedule;

import my.loancalculator.app.model.LoanConfiguration;
import my.loancalculator.app.model.ScheduleEntry;
import my.loancalculator.app.model.ScheduleSummary;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

/**
 * Reduces a simulated schedule to its headline metrics.
 */
public class ScheduleSummaryAggregator {
	private final PaymentFormulas formulas;

	public ScheduleSummaryAggregator(PaymentFormulas formulas) {
		this.formulas = formulas;
	}

	public ScheduleSummary summarize(LoanConfiguration config, List<ScheduleEntry> entries, BigDecimal monthlyRate) {
		BigDecimal totalInterest = BigDecimal.ZERO;
		BigDecimal totalOverpayment = BigDecimal.ZERO;
		BigDecimal maxPayment = BigDecimal.ZERO;
		int paymentsMade = 0;
		for (ScheduleEntry entry : entries) {
			totalInterest = totalInterest.add(entry.interestComponent());
			totalOverpayment = totalOverpayment.add(entry.overpaymentAmount());
			if (entry.holiday()) {
				continue;
			}
			if (entry.payment().signum() > 0) {
				paymentsMade++;
			}
			BigDecimal outflow = entry.cashOutflow();
			if (outflow.compareTo(maxPayment) > 0) {
				maxPayment = outflow;
			}
		}

		BigDecimal financed = config.financedPrincipal();
		YearMonth originalEnd = config.startMonth().plusMonths(config.term() - 1L);
		YearMonth newEnd = entries.isEmpty() ? config.startMonth() : entries.get(entries.size() - 1).month();
		return new ScheduleSummary(
				financed,
				totalInterest,
				totalOverpayment,
				financed.add(totalInterest),
				formulas.effectiveAnnualRate(monthlyRate),
				config.term(),
				originalEnd,
				newEnd,
				paymentsMade,
				maxPayment
		);
	}
}
