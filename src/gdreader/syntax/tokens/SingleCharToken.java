package gdreader.syntax.tokens;

import gdreader.syntax.SimpleToken;

public abstract class SingleCharToken extends SimpleToken {

	public abstract char getChar();

	@Override
	public String getSequence() {
		return String.valueOf(getChar());
	}
}
