package gdreader.syntax.tokens;

import gdreader.reader.ReadingState;
import gdreader.syntax.CharSequenceToken;

/**
 * A line comment, from '#' up to (not including) the line break.
 */
public final class Comment extends CharSequenceToken {

	public Comment() {
	}

	public Comment(String sequence) {
		super(sequence);
	}

	@Override
	protected boolean canAppendChar(char c, ReadingState state) {
		if (sequenceLength() == 0) {
			return c == '#';
		}
		return c != '\n' && c != '\r';
	}
}
