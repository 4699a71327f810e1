package gdreader.syntax.tokens;

public final class CloseBracket extends SingleCharToken {

	@Override
	public char getChar() {
		return ')';
	}
}
