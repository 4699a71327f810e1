package gdreader.syntax.tokens;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.CharSequenceToken;

public final class Identifier extends CharSequenceToken {

	public Identifier() {
	}

	public Identifier(String sequence) {
		super(sequence);
	}

	@Override
	protected boolean canAppendChar(char c, ReadingState state) {
		return sequenceLength() == 0 ? Chars.isIdentifierStart(c) : Chars.isIdentifierPart(c);
	}
}
