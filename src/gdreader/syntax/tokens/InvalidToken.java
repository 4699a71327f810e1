package gdreader.syntax.tokens;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.CharSequenceToken;
import gdreader.syntax.Node;

import java.util.function.Predicate;

/**
 * Text that fits nowhere in the grammar. It always takes its first character and then keeps
 * reading until the stop predicate accepts a character. Blanks it ends with are handed to the
 * parent as a separate {@link Space}.
 */
public final class InvalidToken extends CharSequenceToken {

	private static final Predicate<Character> LINE_END = c -> c == '\n' || c == '\r' || c == '#';

	private final Predicate<Character> stop;

	public InvalidToken(Predicate<Character> stop) {
		this.stop = stop;
	}

	public InvalidToken(String sequence) {
		super(sequence);
		this.stop = LINE_END;
	}

	/**
	 * An invalid token running to the end of the line, or to a comment on it.
	 */
	public static InvalidToken untilLineEnd() {
		return new InvalidToken(LINE_END);
	}

	/**
	 * An invalid token running to the end of the line or to one of the given characters.
	 */
	public static InvalidToken until(String stopChars) {
		return new InvalidToken(c -> LINE_END.test(c) || stopChars.indexOf(c) >= 0);
	}

	@Override
	protected boolean canAppendChar(char c, ReadingState state) {
		return sequenceLength() == 0 || !stop.test(c);
	}

	@Override
	protected void onComplete() {
		Node parent = getParent();
		String text = getSequence();
		int end = text.length();
		while (end > 1 && Chars.isSpace(text.charAt(end - 1))) {
			end--;
		}
		if (parent == null || end == text.length()) {
			return;
		}
		setSequence(text.substring(0, end));
		// nothing was added to the parent while this token was read, so the space lands right after it
		parent.getForm().addBeforeActive(new Space(text.substring(end)));
	}
}
