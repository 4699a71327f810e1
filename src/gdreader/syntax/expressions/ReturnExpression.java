package gdreader.syntax.expressions;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

/**
 * <code>return</code> with an optional result.
 */
public final class ReturnExpression extends Expression {

	public enum State {
		RETURN_KEYWORD,
		RESULT,
		COMPLETED
	}

	public static final Slot<State, Keyword> RETURN_KEYWORD = Slot.of(State.RETURN_KEYWORD, Keyword.class);
	public static final Slot<State, Expression> RESULT = Slot.of(State.RESULT, Expression.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	public ReturnExpression() {
		form.receive(RETURN_KEYWORD, new Keyword(KeywordKind.RETURN));
	}

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Keyword getReturnKeyword() {
		return form.get(RETURN_KEYWORD);
	}

	public Expression getResult() {
		return form.get(RESULT);
	}

	public void setResult(Expression value) {
		form.set(RESULT, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (form.getState() == State.RESULT) {
			if (Chars.isSpace(c)) {
				readSpace(c, state);
				return;
			}
			if (Chars.isExpressionStart(c)) {
				state.push(new ExpressionResolver(form.receiver(RESULT)));
				state.passChar(c);
				return;
			}
			form.skip(RESULT);
		}
		state.popAndPass(c);
	}
}
