package gdreader.syntax.statements;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.expressions.Expression;
import gdreader.syntax.expressions.ExpressionResolver;

/**
 * A call, an assignment, <code>return</code>, <code>pass</code> or any other expression used as a statement.
 */
public final class ExpressionStatement extends Statement {

	public enum State {
		EXPRESSION,
		COMPLETED
	}

	public static final Slot<State, Expression> EXPRESSION = Slot.of(State.EXPRESSION, Expression.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Expression getExpression() {
		return form.get(EXPRESSION);
	}

	public void setExpression(Expression value) {
		form.set(EXPRESSION, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (form.getState() == State.EXPRESSION) {
			if (Chars.isExpressionStart(c)) {
				state.push(new ExpressionResolver(form.receiver(EXPRESSION)));
				state.passChar(c);
				return;
			}
			form.skip(EXPRESSION);
		}
		state.popAndPass(c);
	}
}
