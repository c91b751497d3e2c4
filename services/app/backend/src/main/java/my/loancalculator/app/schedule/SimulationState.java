package my.loancalculator.app.schedule;

import my.loancalculator.app.model.LoanType;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Loop-carried variables of one simulation run. Created at the start of a run, owned by that run only and
 * discarded with it.
 */
final class SimulationState {
	private final LoanType loanType;
	private final PaymentFormulas formulas;
	private final BigDecimal monthlyRate;

	private BigDecimal balance;
	private BigDecimal currentPercent;
	private BigDecimal disbursedPrincipal;
	private int remainingTerm;
	private BigDecimal installment;
	private BigDecimal principalComponent;
	private YearMonth month;
	private int periodIndex;

	SimulationState(LoanType loanType,
					PaymentFormulas formulas,
					BigDecimal monthlyRate,
					BigDecimal openingBalance,
					BigDecimal currentPercent,
					BigDecimal disbursedPrincipal,
					int term,
					YearMonth startMonth) {
		this.loanType = loanType;
		this.formulas = formulas;
		this.monthlyRate = monthlyRate;
		this.balance = openingBalance;
		this.currentPercent = currentPercent;
		this.disbursedPrincipal = disbursedPrincipal;
		this.remainingTerm = term;
		this.month = startMonth;
		this.periodIndex = 1;
		reamortize();
	}

	/**
	 * Recomputes the installment (annuity) or the fixed principal component (decreasing) for the current balance
	 * over the current remaining term.
	 */
	void reamortize() {
		if (loanType == LoanType.ANNUITY) {
			installment = formulas.annuityInstallment(balance, monthlyRate, remainingTerm);
			principalComponent = null;
		} else {
			principalComponent = formulas.decreasingPrincipalComponent(balance, remainingTerm);
			installment = formulas.decreasingInstallment(balance, monthlyRate, remainingTerm);
		}
	}

	void disburse(BigDecimal amount, BigDecimal newPercent) {
		balance = balance.add(amount);
		disbursedPrincipal = disbursedPrincipal.add(amount);
		currentPercent = newPercent;
	}

	void capitalize(BigDecimal interest) {
		balance = balance.add(interest);
	}

	void updateBalance(BigDecimal newBalance) {
		balance = newBalance;
	}

	void decrementTerm() {
		remainingTerm -= 1;
	}

	void advance() {
		month = month.plusMonths(1);
		periodIndex += 1;
	}

	LoanType loanType() {
		return loanType;
	}

	BigDecimal balance() {
		return balance;
	}

	BigDecimal currentPercent() {
		return currentPercent;
	}

	BigDecimal disbursedPrincipal() {
		return disbursedPrincipal;
	}

	int remainingTerm() {
		return remainingTerm;
	}

	BigDecimal installment() {
		return installment;
	}

	BigDecimal principalComponent() {
		return principalComponent;
	}

	YearMonth month() {
		return month;
	}

	int periodIndex() {
		return periodIndex;
	}
}
