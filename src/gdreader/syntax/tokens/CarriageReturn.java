package gdreader.syntax.tokens;

/**
 * Kept for exact reproduction; it contributes nothing to the normalized text, so its length is 0
 * while its origin length is 1.
 */
public final class CarriageReturn extends SingleCharToken {

	@Override
	public char getChar() {
		return '\r';
	}
}
