package gdreader.syntax.tokens;

public final class LeftSlash extends SingleCharToken {

	@Override
	public char getChar() {
		return '\\';
	}
}
