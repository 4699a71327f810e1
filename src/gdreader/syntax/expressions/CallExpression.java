package gdreader.syntax.expressions;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.lists.ExpressionsList;
import gdreader.syntax.tokens.CloseBracket;
import gdreader.syntax.tokens.InvalidToken;
import gdreader.syntax.tokens.OpenBracket;

/**
 * <code>caller(a, b)</code>
 */
public final class CallExpression extends Expression {

	public enum State {
		CALLER,
		OPEN_BRACKET,
		PARAMETERS,
		CLOSE_BRACKET,
		COMPLETED
	}

	public static final Slot<State, Expression> CALLER = Slot.of(State.CALLER, Expression.class);
	public static final Slot<State, OpenBracket> OPEN_BRACKET = Slot.of(State.OPEN_BRACKET, OpenBracket.class);
	public static final Slot<State, ExpressionsList> PARAMETERS = Slot.of(State.PARAMETERS, ExpressionsList.class);
	public static final Slot<State, CloseBracket> CLOSE_BRACKET = Slot.of(State.CLOSE_BRACKET, CloseBracket.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	public CallExpression(Expression caller) {
		form.receive(CALLER, caller);
	}

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Expression getCaller() {
		return form.get(CALLER);
	}

	public void setCaller(Expression value) {
		form.set(CALLER, value);
	}

	public OpenBracket getOpenBracket() {
		return form.get(OPEN_BRACKET);
	}

	public ExpressionsList getParameters() {
		return form.getOrCreate(PARAMETERS, () -> new ExpressionsList(true));
	}

	public void setParameters(ExpressionsList value) {
		form.set(PARAMETERS, value);
	}

	public CloseBracket getCloseBracket() {
		return form.get(CLOSE_BRACKET);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (form.getState()) {
			case OPEN_BRACKET:
				if (c == '(') {
					form.receive(OPEN_BRACKET, new OpenBracket());
					return;
				}
				form.complete();
				break;
			case PARAMETERS:
				if (c == ')') {
					form.skip(PARAMETERS);
					handleChar(c, state);
					return;
				}
				readInto(form, PARAMETERS, new ExpressionsList(true), c, state);
				return;
			case CLOSE_BRACKET:
				if (Chars.isSpace(c)) {
					readSpace(c, state);
					return;
				}
				if (c == ')') {
					form.receive(CLOSE_BRACKET, new CloseBracket());
					return;
				}
				readInvalid(InvalidToken.until(")"), c, state);
				return;
			default:
				break;
		}
		state.popAndPass(c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		switch (form.getState()) {
			case PARAMETERS:
				form.receive(PARAMETERS, state.push(new ExpressionsList(true)));
				state.passNewLine();
				break;
			case CLOSE_BRACKET:
				readNewLine();
				break;
			default:
				state.popAndPassNewLine();
				break;
		}
	}
}
