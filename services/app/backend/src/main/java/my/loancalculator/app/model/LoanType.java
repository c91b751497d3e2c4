package my.loancalculator.app.model;

public enum LoanType {
	/** Equal total installment every period. */
	ANNUITY,
	/** Equal principal component every period; the installment shrinks with the interest. */
	DECREASING
}
