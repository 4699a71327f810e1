package gdreader.syntax.tokens;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.CharSequenceToken;

public final class Space extends CharSequenceToken {

	public Space() {
	}

	public Space(String sequence) {
		super(sequence);
	}

	@Override
	protected boolean canAppendChar(char c, ReadingState state) {
		return Chars.isSpace(c);
	}
}
