package my.loancalculator.app.schedule;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * The iteration bound of twice the term was reached with principal still outstanding. The schedule is incomplete
 * and is not returned.
 */
public class SimulationDivergenceException extends IllegalStateException {
	private final int period;
	private final YearMonth month;
	private final BigDecimal remainingBalance;

	public SimulationDivergenceException(int period, YearMonth month, BigDecimal remainingBalance) {
		super("Schedule did not converge by period " + period + " (" + month + "), remaining balance "
				+ remainingBalance.toPlainString());
		this.period = period;
		this.month = month;
		this.remainingBalance = remainingBalance;
	}

	public int getPeriod() {
		return period;
	}

	public YearMonth getMonth() {
		return month;
	}

	public BigDecimal getRemainingBalance() {
		return remainingBalance;
	}
}
