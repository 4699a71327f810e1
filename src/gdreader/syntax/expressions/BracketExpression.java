package gdreader.syntax.expressions;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.CloseBracket;
import gdreader.syntax.tokens.OpenBracket;

public final class BracketExpression extends Expression {

	public enum State {
		OPEN_BRACKET,
		INNER,
		CLOSE_BRACKET,
		COMPLETED
	}

	public static final Slot<State, OpenBracket> OPEN_BRACKET = Slot.of(State.OPEN_BRACKET, OpenBracket.class);
	public static final Slot<State, Expression> INNER = Slot.of(State.INNER, Expression.class);
	public static final Slot<State, CloseBracket> CLOSE_BRACKET = Slot.of(State.CLOSE_BRACKET, CloseBracket.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public OpenBracket getOpenBracket() {
		return form.get(OPEN_BRACKET);
	}

	public Expression getInner() {
		return form.get(INNER);
	}

	public void setInner(Expression value) {
		form.set(INNER, value);
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
			case INNER:
				if (Chars.isSpace(c)) {
					readSpace(c, state);
					return;
				}
				if (Chars.isExpressionStart(c)) {
					state.push(new ExpressionResolver(form.receiver(INNER), true));
					state.passChar(c);
					return;
				}
				form.skip(INNER);
				handleChar(c, state);
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
				form.skip(CLOSE_BRACKET);
				break;
			default:
				break;
		}
		state.popAndPass(c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		if (form.getState() == State.INNER || form.getState() == State.CLOSE_BRACKET) {
			readNewLine();
		} else {
			state.popAndPassNewLine();
		}
	}
}
