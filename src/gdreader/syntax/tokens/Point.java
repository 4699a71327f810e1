package gdreader.syntax.tokens;

public final class Point extends SingleCharToken {

	@Override
	public char getChar() {
		return '.';
	}
}
