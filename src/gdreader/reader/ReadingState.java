package gdreader.reader;

import gdreader.InternalParserError;
import gdreader.ReaderSettings;

/**
 * Drives the reading automaton: the reader on top of the stack receives every character.
 */
public final class ReadingState {

	private final ReaderSettings settings;
	private final ReadingStack<CharReader> stack = new ReadingStack<>();
	private boolean lineContinuation;
	private int lineColumn;

	public ReadingState(ReaderSettings settings) {
		this.settings = settings;
	}

	public ReaderSettings getSettings() {
		return settings;
	}

	/**
	 * Indentation column of the line being read, as set by the block that took the line.
	 */
	public int getLineColumn() {
		return lineColumn;
	}

	public void setLineColumn(int lineColumn) {
		this.lineColumn = lineColumn;
	}

	public <T extends CharReader> T push(T reader) {
		if (reader == null) {
			throw new InternalParserError("null reader pushed");
		}
		stack.push(reader);
		return reader;
	}

	public void pop() {
		if (!stack.pop().isPresent()) {
			throw new InternalParserError("pop from an empty reading stack");
		}
	}

	public void popAndPass(char c) {
		pop();
		passChar(c);
	}

	public void popAndPassNewLine() {
		pop();
		passNewLine();
	}

	/**
	 * Marks that the next newline continues the current line.
	 */
	public void markLineContinuation() {
		lineContinuation = true;
	}

	public void passChar(char c) {
		switch (c) {
			case '\n':
				passNewLine();
				break;
			case '\r':
				passCarriageReturn();
				break;
			case '#':
				lineContinuation = false;
				top().handleSharpChar(this);
				break;
			case '\\':
				lineContinuation = false;
				top().handleLeftSlashChar(this);
				break;
			default:
				lineContinuation = false;
				top().handleChar(c, this);
				break;
		}
	}

	public void passNewLine() {
		if (lineContinuation) {
			lineContinuation = false;
			top().handleContinuedNewLine(this);
		} else {
			top().handleNewLineChar(this);
		}
	}

	public void passCarriageReturn() {
		top().handleCarriageReturnChar(this);
	}

	public void passString(CharSequence s) {
		for (int i = 0; i < s.length(); i++) {
			passChar(s.charAt(i));
		}
	}

	/**
	 * Force-completes every reader left on the stack, top first.
	 */
	public void complete() {
		lineContinuation = false;
		while (!stack.isEmpty()) {
			CharReader top = stack.top();
			top.forceComplete(this);
			if (stack.top() == top) {
				throw new InternalParserError(top.getClass().getSimpleName() + " stayed on the stack after completion");
			}
		}
	}

	private CharReader top() {
		CharReader top = stack.top();
		if (top == null) {
			throw new InternalParserError("character passed to an empty reading stack");
		}
		return top;
	}
}
