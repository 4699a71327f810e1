package gdreader.syntax.expressions;

import gdreader.InternalParserError;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

/**
 * <code>true</code> or <code>false</code>.
 */
public final class BoolExpression extends Expression {

	public enum State {
		VALUE,
		COMPLETED
	}

	public static final Slot<State, Keyword> VALUE = Slot.of(State.VALUE, Keyword.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	public BoolExpression(boolean value) {
		form.receive(VALUE, new Keyword(value ? KeywordKind.TRUE : KeywordKind.FALSE));
	}

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Keyword getValueKeyword() {
		return form.get(VALUE);
	}

	public boolean getValue() {
		Keyword keyword = getValueKeyword();
		return keyword != null && keyword.getKind() == KeywordKind.TRUE;
	}

	public void setValue(boolean value) {
		form.set(VALUE, new Keyword(value ? KeywordKind.TRUE : KeywordKind.FALSE));
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		throw new InternalParserError("bool expressions are built from a whole word");
	}
}
