package gdreader.syntax.tokens;

public final class FigureCloseBracket extends SingleCharToken {

	@Override
	public char getChar() {
		return '}';
	}
}
