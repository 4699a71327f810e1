package gdreader.syntax.tokens;

public final class OpenBracket extends SingleCharToken {

	@Override
	public char getChar() {
		return '(';
	}
}
