package gdreader;

/**
 * Thrown when the reading automaton itself reaches an impossible configuration.
 * Never raised for malformed scripts; those end up as invalid tokens in the tree.
 */
public class InternalParserError extends RuntimeException {

	public InternalParserError() {
		super("internal parser error");
	}

	public InternalParserError(String message) {
		super("internal parser error: " + message);
	}

	public InternalParserError(Exception e) {
		super("internal parser error", e);
	}
}
