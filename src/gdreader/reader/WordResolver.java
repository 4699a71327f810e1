package gdreader.reader;

import gdreader.InternalParserError;

/**
 * Reads one identifier-like word and hands it to a handler, which decides what construct the
 * word begins. The character that ended the word is passed on afterwards.
 */
public class WordResolver extends CharReader {

	@FunctionalInterface
	public interface WordHandler {
		void handleWord(String word, ReadingState state);
	}

	private final StringBuilder word = new StringBuilder();
	private final WordHandler handler;

	public WordResolver(WordHandler handler) {
		this.handler = handler;
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (word.length() == 0 ? Chars.isIdentifierStart(c) : Chars.isIdentifierPart(c)) {
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
		if (word.length() == 0) {
			throw new InternalParserError("word reader started on a non-identifier character");
		}
		state.pop();
		handler.handleWord(word.toString(), state);
		if (next >= 0) {
			state.passChar((char) next);
		}
	}
}
