package gdreader.syntax.tokens;

public final class SquareOpenBracket extends SingleCharToken {

	@Override
	public char getChar() {
		return '[';
	}
}
