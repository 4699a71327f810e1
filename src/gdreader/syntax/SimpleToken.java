package gdreader.syntax;

import gdreader.InternalParserError;
import gdreader.reader.ReadingState;

/**
 * A leaf whose text is fixed when it is created. Simple tokens are attached complete and never
 * read character by character.
 */
public abstract class SimpleToken extends SyntaxToken {

	public abstract String getSequence();

	@Override
	public void appendTo(StringBuilder builder) {
		builder.append(getSequence());
	}

	@Override
	public String toOriginalString() {
		return getSequence();
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		throw notReadable();
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		throw notReadable();
	}

	@Override
	public void forceComplete(ReadingState state) {
		throw notReadable();
	}

	private InternalParserError notReadable() {
		return new InternalParserError(getClass().getSimpleName() + " was placed on the reading stack");
	}
}
