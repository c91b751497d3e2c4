package my.loancalculator.app.model;

import java.math.BigDecimal;
import java.time.YearMonth;

public record Overpayment(YearMonth month, BigDecimal amount, OverpaymentKind kind) {
	public Overpayment {
		if (month == null) {
			throw new LoanConfigurationException("overpayments", "Overpayment month is required");
		}
		if (amount == null || amount.signum() <= 0) {
			throw new LoanConfigurationException("overpayments",
					"Overpayment amount must be positive for " + month + ": " + amount);
		}
		if (kind == null) {
			throw new LoanConfigurationException("overpayments", "Overpayment kind is required for " + month);
		}
	}
}
