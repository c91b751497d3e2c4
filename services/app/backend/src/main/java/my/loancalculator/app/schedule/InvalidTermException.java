package my.loancalculator.app.schedule;

public class InvalidTermException extends IllegalArgumentException {
	private final int term;

	public InvalidTermException(int term) {
		super("Term must be positive: " + term);
		this.term = term;
	}

	public int getTerm() {
		return term;
	}
}
