package gdreader.syntax.tokens;

public final class SquareCloseBracket extends SingleCharToken {

	@Override
	public char getChar() {
		return ']';
	}
}
