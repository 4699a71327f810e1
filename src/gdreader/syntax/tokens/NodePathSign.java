package gdreader.syntax.tokens;

/**
 * The '$' of a get-node expression, or the '%' of a scene-unique name.
 */
public final class NodePathSign extends SingleCharToken {

	private final char sign;

	public NodePathSign(char sign) {
		this.sign = sign;
	}

	public boolean isUniqueName() {
		return sign == '%';
	}

	@Override
	public char getChar() {
		return sign;
	}
}
