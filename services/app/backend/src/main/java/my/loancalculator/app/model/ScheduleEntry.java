package my.loancalculator.app.model;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * One simulated month. For payment periods {@code payment + overpaymentAmount == principalComponent +
 * interestComponent}; holiday periods pay nothing and capitalize {@code interestComponent} into the ending balance.
 */
public record ScheduleEntry(int periodIndex,
							YearMonth month,
							BigDecimal startingBalance,
							BigDecimal payment,
							BigDecimal principalComponent,
							BigDecimal interestComponent,
							BigDecimal overpaymentAmount,
							BigDecimal endingBalance,
							BigDecimal trancheDisbursedAmount,
							boolean holiday) {
	public BigDecimal cashOutflow() {
		return payment.add(overpaymentAmount);
	}
}
