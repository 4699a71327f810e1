package gdreader.syntax;

import gdreader.reader.ReadingState;

/**
 * A leaf that grows one character at a time for as long as {@link #canAppendChar} accepts, then
 * hands the refused character back to its parent.
 */
public abstract class CharSequenceToken extends SyntaxToken {

	private final StringBuilder sequence = new StringBuilder();

	protected CharSequenceToken() {
	}

	protected CharSequenceToken(String sequence) {
		this.sequence.append(sequence);
	}

	/**
	 * @param c the candidate character
	 * @param state the reading state, or null when the token is built outside a parse
	 */
	protected abstract boolean canAppendChar(char c, ReadingState state);

	public String getSequence() {
		return sequence.toString();
	}

	public void setSequence(String value) {
		sequence.setLength(0);
		sequence.append(value);
	}

	public void appendChar(char c) {
		sequence.append(c);
	}

	protected int sequenceLength() {
		return sequence.length();
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (canAppendChar(c, state)) {
			sequence.append(c);
		} else {
			onComplete();
			state.popAndPass(c);
		}
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		if (canAppendChar('\n', state)) {
			sequence.append('\n');
		} else {
			onComplete();
			state.popAndPassNewLine();
		}
	}

	@Override
	public void forceComplete(ReadingState state) {
		onComplete();
		state.pop();
	}

	/**
	 * Called once the token has read its last character, before it leaves the stack.
	 */
	protected void onComplete() {
	}

	@Override
	public void appendTo(StringBuilder builder) {
		builder.append(sequence);
	}

	@Override
	public String toOriginalString() {
		return sequence.toString();
	}
}
