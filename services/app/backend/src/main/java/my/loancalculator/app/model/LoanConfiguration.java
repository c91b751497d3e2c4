package my.loancalculator.app.model;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Set;

/**
 * One loan scenario. Instances are validated on construction and never change afterwards.
 *
 * @param principal      total loan amount before the down payment
 * @param downPayment    amount paid up front, subtracted from {@code principal}
 * @param rate           nominal annual rate in percent ({@code 3.5} means 3.5%)
 * @param term           scheduled number of monthly payments
 * @param startMonth     month of the first scheduled payment
 * @param loanType       installment style
 * @param tranches       phased disbursements, cumulative percent of the financed principal
 * @param overpayments   extra principal payments; several may share a month
 * @param holidays       payment-free months
 * @param targetPayment  optional fixed monthly budget, {@code null} when not used
 */
public record LoanConfiguration(BigDecimal principal,
								BigDecimal downPayment,
								BigDecimal rate,
								int term,
								YearMonth startMonth,
								LoanType loanType,
								List<Tranche> tranches,
								List<Overpayment> overpayments,
								Set<YearMonth> holidays,
								BigDecimal targetPayment) {
	public static final int MAX_TERM = 1200;

	public LoanConfiguration {
		if (principal == null) {
			throw new LoanConfigurationException("principal", "Principal is required");
		}
		downPayment = downPayment == null ? BigDecimal.ZERO : downPayment;
		if (downPayment.signum() < 0) {
			throw new LoanConfigurationException("down_payment", "Down payment must not be negative");
		}
		if (principal.subtract(downPayment).signum() <= 0) {
			throw new LoanConfigurationException("principal", "Financed principal must be positive after down payment");
		}
		if (term <= 0) {
			throw new LoanConfigurationException("term", "Term must be positive: " + term);
		}
		if (term > MAX_TERM) {
			throw new LoanConfigurationException("term", "Term must not exceed " + MAX_TERM + " months: " + term);
		}
		if (rate == null) {
			throw new LoanConfigurationException("rate", "Rate is required");
		}
		if (rate.signum() < 0) {
			throw new LoanConfigurationException("rate", "Rate must not be negative: " + rate);
		}
		if (startMonth == null) {
			throw new LoanConfigurationException("start_month", "Start month is required");
		}
		if (loanType == null) {
			throw new LoanConfigurationException("loan_type", "Loan type is required");
		}
		if (targetPayment != null && targetPayment.signum() <= 0) {
			throw new LoanConfigurationException("target_payment", "Target payment must be positive: " + targetPayment);
		}
		tranches = tranches == null ? List.of() : List.copyOf(tranches);
		overpayments = overpayments == null ? List.of() : List.copyOf(overpayments);
		holidays = holidays == null ? Set.of() : Set.copyOf(holidays);
	}

	public static Builder builder() {
		return new Builder();
	}

	public BigDecimal financedPrincipal() {
		return principal.subtract(downPayment);
	}

	/**
	 * Same loan with every overpayment and the target payment removed.
	 */
	public LoanConfiguration withoutPrepayments() {
		return new LoanConfiguration(principal, downPayment, rate, term, startMonth, loanType,
				tranches, List.of(), holidays, null);
	}

	public boolean hasPrepayments() {
		return !overpayments.isEmpty() || targetPayment != null;
	}

	public Builder toBuilder() {
		return new Builder()
				.principal(principal)
				.downPayment(downPayment)
				.rate(rate)
				.term(term)
				.startMonth(startMonth)
				.loanType(loanType)
				.tranches(tranches)
				.overpayments(overpayments)
				.holidays(holidays)
				.targetPayment(targetPayment);
	}

	public static final class Builder {
		private BigDecimal principal;
		private BigDecimal downPayment = BigDecimal.ZERO;
		private BigDecimal rate;
		private int term;
		private YearMonth startMonth;
		private LoanType loanType = LoanType.ANNUITY;
		private List<Tranche> tranches = List.of();
		private List<Overpayment> overpayments = List.of();
		private Set<YearMonth> holidays = Set.of();
		private BigDecimal targetPayment;

		private Builder() {
		}

		public Builder principal(BigDecimal principal) {
			this.principal = principal;
			return this;
		}

		public Builder downPayment(BigDecimal downPayment) {
			this.downPayment = downPayment;
			return this;
		}

		public Builder rate(BigDecimal rate) {
			this.rate = rate;
			return this;
		}

		public Builder term(int term) {
			this.term = term;
			return this;
		}

		public Builder startMonth(YearMonth startMonth) {
			this.startMonth = startMonth;
			return this;
		}

		public Builder loanType(LoanType loanType) {
			this.loanType = loanType;
			return this;
		}

		public Builder tranches(List<Tranche> tranches) {
			this.tranches = tranches;
			return this;
		}

		public Builder overpayments(List<Overpayment> overpayments) {
			this.overpayments = overpayments;
			return this;
		}

		public Builder holidays(Set<YearMonth> holidays) {
			this.holidays = holidays;
			return this;
		}

		public Builder targetPayment(BigDecimal targetPayment) {
			this.targetPayment = targetPayment;
			return this;
		}

		public LoanConfiguration build() {
			return new LoanConfiguration(principal, downPayment, rate, term, startMonth, loanType,
					tranches, overpayments, holidays, targetPayment);
		}
	}
}
