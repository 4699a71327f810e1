package gdreader;

/**
 * A receiver callback arrived while its node was already past the slot it targets.
 */
public class InvalidReadingStateError extends InternalParserError {

	private final Enum<?> expected;
	private final Enum<?> actual;

	public InvalidReadingStateError(Enum<?> expected, Enum<?> actual) {
		super("slot " + expected + " cannot be filled in state " + actual);
		this.expected = expected;
		this.actual = actual;
	}

	public Enum<?> getExpected() {
		return expected;
	}

	public Enum<?> getActual() {
		return actual;
	}
}
