package gdreader.syntax.tokens;

public final class Colon extends SingleCharToken {

	@Override
	public char getChar() {
		return ':';
	}
}
