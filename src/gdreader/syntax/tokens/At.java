package gdreader.syntax.tokens;

public final class At extends SingleCharToken {

	@Override
	public char getChar() {
		return '@';
	}
}
