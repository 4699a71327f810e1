package gdreader.syntax.tokens;

public final class FigureOpenBracket extends SingleCharToken {

	@Override
	public char getChar() {
		return '{';
	}
}
