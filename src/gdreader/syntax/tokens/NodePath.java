package gdreader.syntax.tokens;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.CharSequenceToken;

/**
 * An unquoted node path such as <code>Body/Sprite</code> or <code>%Label</code>. A '.' ends the
 * path, so <code>$Body.position</code> reads the member of the node.
 */
public final class NodePath extends CharSequenceToken {

	public NodePath() {
	}

	public NodePath(String sequence) {
		super(sequence);
	}

	public static boolean isPathStart(char c) {
		return Chars.isIdentifierStart(c) || c == '/' || c == '%';
	}

	@Override
	protected boolean canAppendChar(char c, ReadingState state) {
		return sequenceLength() == 0 ? isPathStart(c) : Chars.isIdentifierPart(c) || c == '/' || c == '%';
	}
}
