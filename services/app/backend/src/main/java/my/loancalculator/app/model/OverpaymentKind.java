package my.loancalculator.app.model;

public enum OverpaymentKind {
	/** Keep the installment, shorten the remaining term. */
	TERM,
	/** Keep the horizon, re-amortize to a lower installment. */
	INSTALLMENT
}
