package gdreader.reader;

/**
 * Looks at the start of the next line: buffers the line break, the indentation and the first word,
 * then asks a handler whether the line continues the construct that pushed this resolver
 * (an <code>elif</code> after an <code>if</code> body, for example).
 */
public class NextLineResolver extends CharReader {

	@FunctionalInterface
	public interface NextLineHandler {
		/**
		 * @param whitespace the buffered line breaks and indentation
		 * @param word the first word on the line, possibly empty
		 * @param column the indentation column of the line
		 * @return true if the handler took the whitespace; false if it left the stack, so that
		 * everything buffered goes to the reader below it
		 */
		boolean handleNextLine(String whitespace, String word, int column, ReadingState state);
	}

	private final StringBuilder whitespace = new StringBuilder();
	private final StringBuilder word = new StringBuilder();
	private final NextLineHandler handler;

	public NextLineResolver(NextLineHandler handler) {
		this.handler = handler;
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (word.length() == 0 && (Chars.isSpace(c) || c == '\r')) {
			whitespace.append(c);
		} else if (word.length() == 0 ? Chars.isIdentifierStart(c) : Chars.isIdentifierPart(c)) {
			word.append(c);
		} else {
			finish(state, c);
		}
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		if (word.length() == 0) {
			whitespace.append('\n');
		} else {
			finish(state, '\n');
		}
	}

	@Override
	public void forceComplete(ReadingState state) {
		finish(state, -1);
	}

	private void finish(ReadingState state, int next) {
		state.pop();
		int column = Chars.lastLineWidth(whitespace, state.getSettings().getTabSize());
		if (!handler.handleNextLine(whitespace.toString(), word.toString(), column, state)) {
			state.passString(whitespace);
		}
		state.passString(word);
		if (next >= 0) {
			state.passChar((char) next);
		}
	}
}
