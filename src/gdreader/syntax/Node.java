package gdreader.syntax;

import gdreader.reader.ReadingState;
import gdreader.syntax.tokens.CarriageReturn;
import gdreader.syntax.tokens.Comment;
import gdreader.syntax.tokens.InvalidToken;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;
import gdreader.syntax.tokens.LeftSlash;
import gdreader.syntax.tokens.NewLine;
import gdreader.syntax.tokens.Space;

/**
 * A composite element. Its children live in its form; by default it keeps comments, carriage
 * returns and line continuations as incidental tokens and ends at a line break.
 */
public abstract class Node extends SyntaxToken {

	public abstract AbstractTokensForm getForm();

	@Override
	public void appendTo(StringBuilder builder) {
		for (SyntaxToken t : getForm()) {
			t.appendTo(builder);
		}
	}

	/**
	 * The direct children, incidental tokens included.
	 */
	public Iterable<SyntaxToken> getTokens() {
		return getForm();
	}

	public Iterable<SyntaxToken> getAllTokens() {
		return TreeIterables.descendants(this);
	}

	public Iterable<Node> getAllNodes() {
		return TreeIterables.descendants(this, Node.class);
	}

	public Iterable<InvalidToken> getAllInvalidTokens() {
		return TreeIterables.descendants(this, InvalidToken.class);
	}

	/**
	 * The first leaf of this subtree, or null if it has none.
	 */
	public SyntaxToken getFirstToken() {
		for (SyntaxToken t : getAllTokens()) {
			if (!(t instanceof Node)) {
				return t;
			}
		}
		return null;
	}

	public SyntaxToken getLastToken() {
		SyntaxToken last = null;
		for (SyntaxToken t : getAllTokens()) {
			if (!(t instanceof Node)) {
				last = t;
			}
		}
		return last;
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		state.popAndPassNewLine();
	}

	// a completed node leaves comments and line continuations to its parent

	@Override
	public void handleSharpChar(ReadingState state) {
		if (isFormCompleted()) {
			state.pop();
			state.passChar('#');
		} else {
			readComment(state);
		}
	}

	@Override
	public void handleCarriageReturnChar(ReadingState state) {
		if (isFormCompleted()) {
			state.pop();
			state.passCarriageReturn();
		} else {
			getForm().addBeforeActive(new CarriageReturn());
		}
	}

	@Override
	public void handleLeftSlashChar(ReadingState state) {
		if (isFormCompleted()) {
			state.pop();
			state.passChar('\\');
		} else {
			getForm().addBeforeActive(new LeftSlash());
			state.markLineContinuation();
		}
	}

	private boolean isFormCompleted() {
		AbstractTokensForm form = getForm();
		return form instanceof TokensForm && ((TokensForm<?>) form).isCompleted();
	}

	@Override
	public void handleContinuedNewLine(ReadingState state) {
		getForm().addBeforeActive(new NewLine());
	}

	@Override
	public void forceComplete(ReadingState state) {
		state.pop();
	}

	protected void readSpace(char c, ReadingState state) {
		getForm().addBeforeActive(state.push(new Space()));
		state.passChar(c);
	}

	protected void readComment(ReadingState state) {
		getForm().addBeforeActive(state.push(new Comment()));
		state.passChar('#');
	}

	protected void readNewLine() {
		getForm().addBeforeActive(new NewLine());
	}

	protected void readInvalid(InvalidToken token, char c, ReadingState state) {
		getForm().addBeforeActive(state.push(token));
		state.passChar(c);
	}

	/**
	 * Puts a token into its slot and makes it read the current character.
	 */
	protected <S extends Enum<S>, T extends SyntaxToken> T readInto(TokensForm<S> form, Slot<S, T> slot, T token,
	                                                                 char c, ReadingState state) {
		form.receive(slot, token);
		state.push(token);
		state.passChar(c);
		return token;
	}

	protected void readKeyword(KeywordKind kind, TokenReceiver<Keyword> receiver, char c, ReadingState state) {
		state.push(new KeywordResolver(kind, receiver));
		state.passChar(c);
	}
}
