package my.loancalculator.app.importer;

/**
 * A textual loan input could not be read. Carries the input field and the raw value.
 */
public class LoanInputParseException extends IllegalArgumentException {
	private final String field;
	private final String value;

	public LoanInputParseException(String field, String value, String message) {
		super(message);
		this.field = field;
		this.value = value;
	}

	public LoanInputParseException(String field, String value, String message, Throwable cause) {
		super(message, cause);
		this.field = field;
		this.value = value;
	}

	public String getField() {
		return field;
	}

	public String getValue() {
		return value;
	}
}
