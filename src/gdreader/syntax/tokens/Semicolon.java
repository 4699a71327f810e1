package gdreader.syntax.tokens;

public final class Semicolon extends SingleCharToken {

	@Override
	public char getChar() {
		return ';';
	}
}
