package gdreader.syntax.tokens;

public final class Comma extends SingleCharToken {

	@Override
	public char getChar() {
		return ',';
	}
}
