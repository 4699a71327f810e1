package gdreader.syntax.expressions;

import gdreader.InternalParserError;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

/**
 * A keyword used as a value or a statement on its own: <code>pass</code>, <code>break</code>,
 * <code>continue</code>, <code>breakpoint</code>, <code>null</code>, <code>self</code>.
 */
public final class KeywordExpression extends Expression {

	public enum State {
		KEYWORD,
		COMPLETED
	}

	public static final Slot<State, Keyword> KEYWORD = Slot.of(State.KEYWORD, Keyword.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	public KeywordExpression(KeywordKind kind) {
		form.receive(KEYWORD, new Keyword(kind));
	}

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Keyword getKeyword() {
		return form.get(KEYWORD);
	}

	public void setKeyword(Keyword value) {
		form.set(KEYWORD, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		throw new InternalParserError("keyword expressions are built from a whole word");
	}
}
