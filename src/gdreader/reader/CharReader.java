package gdreader.reader;

/**
 * Anything that can sit on the reading stack and be fed characters.
 *
 * Newlines, '#', carriage returns and backslashes have their own entry points because almost
 * every construct treats them differently from ordinary characters. Unless overridden they are
 * forwarded to {@link #handleChar(char, ReadingState)}.
 */
public abstract class CharReader {

	public abstract void handleChar(char c, ReadingState state);

	public abstract void handleNewLineChar(ReadingState state);

	public void handleSharpChar(ReadingState state) {
		handleChar('#', state);
	}

	public void handleCarriageReturnChar(ReadingState state) {
		handleChar('\r', state);
	}

	public void handleLeftSlashChar(ReadingState state) {
		handleChar('\\', state);
	}

	/**
	 * A newline directly preceded by a line-continuation backslash.
	 */
	public void handleContinuedNewLine(ReadingState state) {
		handleNewLineChar(state);
	}

	/**
	 * Called when the input is exhausted. Implementations must leave the stack.
	 */
	public abstract void forceComplete(ReadingState state);
}
