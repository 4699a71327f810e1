package gdreader.syntax.tokens;

/**
 * The '&amp;' of a string name literal or the '^' of a node path literal.
 */
public final class StringPrefix extends SingleCharToken {

	private final char prefix;

	public StringPrefix(char prefix) {
		this.prefix = prefix;
	}

	public static boolean isPrefix(char c) {
		return c == '&' || c == '^';
	}

	@Override
	public char getChar() {
		return prefix;
	}
}
