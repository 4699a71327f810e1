package gdreader.syntax.lists;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Node;
import gdreader.syntax.SyntaxToken;
import gdreader.syntax.TokensListForm;
import gdreader.syntax.tokens.Comma;
import gdreader.syntax.tokens.InvalidToken;

import java.util.List;

/**
 * Items separated by commas, usually between brackets. The list never reads its own closing
 * bracket; it leaves the stack and the owner takes it.
 */
public abstract class SeparatedTokensList<T extends SyntaxToken> extends Node {

	private final TokensListForm<T> form = new TokensListForm<>(this);
	private final boolean allowNewLines;
	private boolean starting;

	protected SeparatedTokensList(boolean allowNewLines) {
		this.allowNewLines = allowNewLines;
	}

	@Override
	public TokensListForm<T> getForm() {
		return form;
	}

	public List<T> getItems() {
		return form.getItems();
	}

	public boolean isAllowNewLines() {
		return allowNewLines;
	}

	protected abstract boolean isItemStart(char c);

	protected abstract void startItem(char c, ReadingState state);

	/**
	 * Characters at which the list stops. Any other character that cannot start an item is read
	 * as an invalid token running up to one of them. Null means every such character ends the list.
	 */
	protected String getClosingChars() {
		return null;
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (Chars.isSpace(c)) {
			readSpace(c, state);
			return;
		}
		if (c == ',') {
			form.addToEnd(new Comma());
			return;
		}
		if (!starting && isItemStart(c)) {
			starting = true;
			startItem(c, state);
			starting = false;
			return;
		}
		starting = false;
		String closing = getClosingChars();
		if (closing == null || closing.indexOf(c) >= 0) {
			state.popAndPass(c);
		} else {
			readInvalid(InvalidToken.until(closing + ","), c, state);
		}
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		if (allowNewLines) {
			readNewLine();
		} else {
			state.popAndPassNewLine();
		}
	}
}
