package gdreader.syntax.lists;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.reader.WordResolver;
import gdreader.syntax.IncidentalTokens;
import gdreader.syntax.Node;
import gdreader.syntax.TokensListForm;
import gdreader.syntax.tokens.InvalidToken;
import gdreader.syntax.tokens.Semicolon;

import java.util.List;

/**
 * A block of lines at one indentation level: class members, statements of a body, match cases.
 *
 * A block started on its owner's line (<code>if a: pass</code>) ends at the line break. Otherwise
 * the line break and indentation of each following line are held back until the first character
 * of the line shows its column: a line indented less than the block ends the block, and the held
 * back text is passed on to the owner. Blank lines and comment lines always stay in the block.
 */
public abstract class IntendedTokensList<T extends Node> extends Node {

	private enum Mode {
		NOT_STARTED,
		LINE_START,
		IN_LINE
	}

	private final TokensListForm<T> form = new TokensListForm<>(this);
	private final int parentColumn;
	private final StringBuilder pending = new StringBuilder();
	private Mode mode;
	private boolean inline;
	private int blockColumn = -1;
	private int lineColumn;
	private T lastStarted;

	/**
	 * @param parentColumn column of the line that owns the block; a negative column makes a block
	 * that takes every line, starting at the beginning of a line
	 */
	protected IntendedTokensList(int parentColumn) {
		this.parentColumn = parentColumn;
		this.lineColumn = Math.max(parentColumn, 0);
		this.mode = parentColumn < 0 ? Mode.LINE_START : Mode.NOT_STARTED;
	}

	@Override
	public TokensListForm<T> getForm() {
		return form;
	}

	public List<T> getItems() {
		return form.getItems();
	}

	public int getParentColumn() {
		return parentColumn;
	}

	/**
	 * Indentation column of the block's lines, or -1 if no line was read yet.
	 */
	public int getBlockColumn() {
		return blockColumn;
	}

	public boolean isInline() {
		return inline;
	}

	/**
	 * Column of the line currently being read. Items started on it take it as their own.
	 */
	protected int getLineColumn() {
		return lineColumn;
	}

	/**
	 * Starts the item that begins with <code>c</code>. Implementations call {@link #pushItem},
	 * {@link #startWord} or {@link #readInvalidLine}.
	 */
	protected abstract void startItem(char c, ReadingState state);

	/**
	 * Decides which item a leading word begins.
	 */
	protected abstract void startItemWithWord(String word, ReadingState state);

	/**
	 * Whether the character ends the block where a new item would start. The block leaves the
	 * stack and hands the character to its owner.
	 */
	protected boolean isClosingChar(char c) {
		return false;
	}

	protected void pushItem(T item, char c, ReadingState state) {
		form.add(item);
		lastStarted = item;
		state.push(item);
		state.passChar(c);
	}

	protected void pushItem(T item, String word, ReadingState state) {
		form.add(item);
		lastStarted = item;
		state.push(item);
		state.passString(word);
	}

	protected void startWord(char c, ReadingState state) {
		state.push(new WordResolver(this::startItemWithWord));
		state.passChar(c);
	}

	protected void readInvalidLine(char c, ReadingState state) {
		readInvalid(InvalidToken.untilLineEnd(), c, state);
	}

	protected void readInvalidLine(String word, ReadingState state) {
		form.addToEnd(state.push(InvalidToken.untilLineEnd()));
		state.passString(word);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (mode) {
			case NOT_STARTED:
				mode = Mode.IN_LINE;
				inline = true;
				handleInLine(c, state);
				break;
			case LINE_START:
				handleLineStart(c, state);
				break;
			default:
				handleInLine(c, state);
				break;
		}
	}

	private void handleLineStart(char c, ReadingState state) {
		if (Chars.isSpace(c)) {
			pending.append(c);
			return;
		}
		int column = Chars.lastLineWidth(pending, state.getSettings().getTabSize());
		if (!belongsToBlock(column)) {
			String held = pending.toString();
			pending.setLength(0);
			state.pop();
			state.passString(held);
			state.passChar(c);
			return;
		}
		if (blockColumn < 0) {
			blockColumn = column;
		}
		flushPending();
		mode = Mode.IN_LINE;
		lineColumn = column;
		state.setLineColumn(column);
		handleInLine(c, state);
	}

	private boolean belongsToBlock(int column) {
		if (parentColumn < 0) {
			return true;
		}
		if (blockColumn < 0) {
			return column > parentColumn;
		}
		return column >= blockColumn;
	}

	private void handleInLine(char c, ReadingState state) {
		if (Chars.isSpace(c)) {
			readSpace(c, state);
			return;
		}
		if (c == ';') {
			form.addToEnd(new Semicolon());
			return;
		}
		if (lastStarted != null && lastStarted.getOriginLength() == 0) {
			// the item refused its first character
			form.remove(lastStarted);
			lastStarted = null;
			readInvalidLine(c, state);
			return;
		}
		lastStarted = null;
		if (isClosingChar(c)) {
			state.popAndPass(c);
			return;
		}
		startItem(c, state);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		switch (mode) {
			case NOT_STARTED:
				mode = Mode.LINE_START;
				pending.append('\n');
				break;
			case LINE_START:
				flushPending();
				pending.append('\n');
				break;
			default:
				if (inline) {
					state.popAndPassNewLine();
				} else {
					mode = Mode.LINE_START;
					pending.append('\n');
				}
				break;
		}
	}

	@Override
	public void handleContinuedNewLine(ReadingState state) {
		if (mode == Mode.IN_LINE) {
			super.handleContinuedNewLine(state);
		} else {
			handleNewLineChar(state);
		}
	}

	@Override
	public void handleSharpChar(ReadingState state) {
		if (mode == Mode.LINE_START) {
			flushPending();
		} else if (mode == Mode.NOT_STARTED) {
			mode = Mode.IN_LINE;
			inline = true;
		}
		readComment(state);
	}

	@Override
	public void handleCarriageReturnChar(ReadingState state) {
		if (mode == Mode.LINE_START) {
			pending.append('\r');
		} else {
			super.handleCarriageReturnChar(state);
		}
	}

	@Override
	public void handleLeftSlashChar(ReadingState state) {
		if (mode == Mode.IN_LINE) {
			super.handleLeftSlashChar(state);
		} else {
			handleChar('\\', state);
		}
	}

	@Override
	public void forceComplete(ReadingState state) {
		flushPending();
		state.pop();
	}

	private void flushPending() {
		if (pending.length() == 0) {
			return;
		}
		IncidentalTokens.addBeforeActive(form, pending);
		pending.setLength(0);
	}
}
