package my.loancalculator.app.model;

/**
 * Raised when a loan scenario violates a configuration invariant. Nothing is simulated for such a scenario.
 */
public class LoanConfigurationException extends IllegalArgumentException {
	private final String field;

	public LoanConfigurationException(String field, String message) {
		super(message);
		this.field = field;
	}

	public String getField() {
		return field;
	}
}
