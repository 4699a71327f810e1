package gdreader.reader;

/**
 * Buffers characters while they still prefix one of the candidates of its table, then resolves
 * to the longest candidate matched so far. Whatever was buffered beyond the match, and the
 * character that stopped the buffering, are passed on to the reader below.
 */
public abstract class SequenceResolver extends CharReader {

	private final StringBuilder buffer = new StringBuilder();

	protected abstract SequenceTable getTable();

	/**
	 * @return false if the match is refused, in which case the whole buffer is passed on
	 */
	protected abstract boolean onMatch(String sequence, ReadingState state);

	protected abstract void onNoMatch(ReadingState state);

	@Override
	public void handleChar(char c, ReadingState state) {
		buffer.append(c);
		if (getTable().hasPrefix(buffer)) {
			return;
		}
		buffer.setLength(buffer.length() - 1);
		resolve(state, c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		resolve(state, '\n');
	}

	@Override
	public void forceComplete(ReadingState state) {
		resolve(state, -1);
	}

	private void resolve(ReadingState state, int next) {
		state.pop();
		String match = getTable().longestMatch(buffer, next);
		String rest = buffer.toString();
		if (match == null) {
			onNoMatch(state);
		} else if (onMatch(match, state)) {
			rest = rest.substring(match.length());
		}
		state.passString(rest);
		if (next >= 0) {
			state.passChar((char) next);
		}
	}
}
