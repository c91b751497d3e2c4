package my.loancalculator.app.schedule;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Closed-form installment formulas. Pure functions evaluated in the {@link MathContext} given at construction.
 */
public final class PaymentFormulas {
	private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
	private static final BigDecimal MONTHS_PER_YEAR = new BigDecimal("12");

	private final MathContext mathContext;

	public PaymentFormulas(MathContext mathContext) {
		if (mathContext == null) {
			throw new IllegalArgumentException("mathContext must not be null");
		}
		this.mathContext = mathContext;
	}

	/**
	 * Nominal annual percent to the monthly decimal rate, e.g. {@code 6} to {@code 0.005}.
	 */
	public BigDecimal monthlyRate(BigDecimal annualPercent) {
		return annualPercent.divide(ONE_HUNDRED, mathContext).divide(MONTHS_PER_YEAR, mathContext);
	}

	/**
	 * {@code P·i·(1+i)^n / ((1+i)^n − 1)}, or {@code P/n} when the rate is zero.
	 */
	public BigDecimal annuityInstallment(BigDecimal principal, BigDecimal monthlyRate, int term) {
		requirePositiveTerm(term);
		if (monthlyRate.signum() == 0) {
			return principal.divide(BigDecimal.valueOf(term), mathContext);
		}
		BigDecimal factor = BigDecimal.ONE.add(monthlyRate).pow(term, mathContext);
		BigDecimal numerator = principal.multiply(monthlyRate, mathContext).multiply(factor, mathContext);
		return numerator.divide(factor.subtract(BigDecimal.ONE, mathContext), mathContext);
	}

	public BigDecimal decreasingPrincipalComponent(BigDecimal principal, int term) {
		requirePositiveTerm(term);
		return principal.divide(BigDecimal.valueOf(term), mathContext);
	}

	/**
	 * First installment of a decreasing loan: the fixed principal component plus one month of interest.
	 */
	public BigDecimal decreasingInstallment(BigDecimal principal, BigDecimal monthlyRate, int term) {
		return decreasingPrincipalComponent(principal, term).add(interest(principal, monthlyRate));
	}

	public BigDecimal interest(BigDecimal balance, BigDecimal monthlyRate) {
		return balance.multiply(monthlyRate, mathContext);
	}

	/**
	 * Approximate effective annual rate {@code (1+i)^12 − 1}.
	 */
	public BigDecimal effectiveAnnualRate(BigDecimal monthlyRate) {
		return BigDecimal.ONE.add(monthlyRate).pow(12, mathContext).subtract(BigDecimal.ONE, mathContext);
	}

	private static void requirePositiveTerm(int term) {
		if (term <= 0) {
			throw new InvalidTermException(term);
		}
	}
}
