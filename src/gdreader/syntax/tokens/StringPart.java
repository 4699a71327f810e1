package gdreader.syntax.tokens;

import gdreader.reader.ReadingState;
import gdreader.syntax.CharSequenceToken;

/**
 * The raw body of a string literal, escapes left as written. Filled by the enclosing string
 * expression, which decides where the body ends.
 */
public final class StringPart extends CharSequenceToken {

	public StringPart() {
	}

	public StringPart(String sequence) {
		super(sequence);
	}

	@Override
	protected boolean canAppendChar(char c, ReadingState state) {
		return true;
	}
}
