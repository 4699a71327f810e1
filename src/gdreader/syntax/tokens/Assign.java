package gdreader.syntax.tokens;

public final class Assign extends SingleCharToken {

	@Override
	public char getChar() {
		return '=';
	}
}
