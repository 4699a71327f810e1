package gdreader.syntax.tokens;

public final class NewLine extends SingleCharToken {

	@Override
	public char getChar() {
		return '\n';
	}
}
