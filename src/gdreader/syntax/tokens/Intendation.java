package gdreader.syntax.tokens;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.CharSequenceToken;

/**
 * Whitespace at the start of a line.
 */
public final class Intendation extends CharSequenceToken {

	public Intendation() {
	}

	public Intendation(String sequence) {
		super(sequence);
	}

	@Override
	protected boolean canAppendChar(char c, ReadingState state) {
		return Chars.isSpace(c);
	}

	/**
	 * The column this indentation reaches, counting a tab as <code>tabSize</code> columns.
	 */
	public int getColumn(int tabSize) {
		return Chars.lastLineWidth(getSequence(), tabSize);
	}
}
