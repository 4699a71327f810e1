package gdreader.reader;

/**
 * Character classes shared by every reader.
 */
public final class Chars {

	private Chars() {
	}

	public static boolean isSpace(char c) {
		return c == ' ' || c == '\t';
	}

	public static boolean isIdentifierStart(char c) {
		return c == '_' || Character.isLetter(c);
	}

	public static boolean isIdentifierPart(char c) {
		return c == '_' || Character.isLetterOrDigit(c);
	}

	public static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	public static boolean isQuote(char c) {
		return c == '"' || c == '\'';
	}

	/**
	 * Characters that can begin an expression. Lists rely on this to decide whether to start an
	 * item, so every reader an expression starts with must consume the character.
	 */
	public static boolean isExpressionStart(char c) {
		if (isIdentifierStart(c) || isDigit(c) || isQuote(c)) {
			return true;
		}
		switch (c) {
			case '(':
			case '[':
			case '{':
			case '-':
			case '!':
			case '~':
			case '$':
			case '%':
			case '&':
			case '^':
				return true;
			default:
				return false;
		}
	}

	/**
	 * Width in columns of the last line of the given whitespace run.
	 */
	public static int lastLineWidth(CharSequence whitespace, int tabSize) {
		int column = 0;
		for (int i = 0; i < whitespace.length(); i++) {
			char c = whitespace.charAt(i);
			if (c == '\n') {
				column = 0;
			} else if (c == '\t') {
				column += tabSize;
			} else if (c != '\r') {
				column++;
			}
		}
		return column;
	}
}
