package gdreader.reader;

/**
 * Looks at the next word on the current line: buffers blanks and the word, lets a handler push
 * the reader that should get them, then passes everything buffered on. Used where a leading
 * modifier alone does not tell which construct follows (<code>static var</code> or
 * <code>static func</code>).
 */
public class NextWordResolver extends CharReader {

	@FunctionalInterface
	public interface NextWordHandler {
		/**
		 * @param word the next word on the line, possibly empty
		 */
		void handleNextWord(String word, ReadingState state);
	}

	private final StringBuilder blanks = new StringBuilder();
	private final StringBuilder word = new StringBuilder();
	private final NextWordHandler handler;

	public NextWordResolver(NextWordHandler handler) {
		this.handler = handler;
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (word.length() == 0 && Chars.isSpace(c)) {
			blanks.append(c);
		} else if (word.length() == 0 ? Chars.isIdentifierStart(c) : Chars.isIdentifierPart(c)) {
			word.append(c);
		} else {
			finish(state, c);
		}
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		finish(state, '\n');
	}

	@Override
	public void forceComplete(ReadingState state) {
		finish(state, -1);
	}

	private void finish(ReadingState state, int next) {
		state.pop();
		handler.handleNextWord(word.toString(), state);
		state.passString(blanks);
		state.passString(word);
		if (next >= 0) {
			state.passChar((char) next);
		}
	}
}
