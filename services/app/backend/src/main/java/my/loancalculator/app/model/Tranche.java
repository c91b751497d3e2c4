package my.loancalculator.app.model;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Phased disbursement: {@code cumulativePercent} (0..1) of the financed principal is released by {@code month}.
 */
public record Tranche(YearMonth month, BigDecimal cumulativePercent) {
	public Tranche {
		if (month == null) {
			throw new LoanConfigurationException("tranches", "Tranche month is required");
		}
		if (cumulativePercent == null
				|| cumulativePercent.signum() < 0
				|| cumulativePercent.compareTo(BigDecimal.ONE) > 0) {
			throw new LoanConfigurationException("tranches",
					"Tranche percent must be between 0 and 1 for " + month + ": " + cumulativePercent);
		}
	}
}
