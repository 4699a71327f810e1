package gdreader.syntax.expressions;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.InvalidToken;
import gdreader.syntax.tokens.SquareCloseBracket;
import gdreader.syntax.tokens.SquareOpenBracket;

/**
 * <code>caller[index]</code>
 */
public final class IndexerExpression extends Expression {

	public enum State {
		CALLER,
		SQUARE_OPEN_BRACKET,
		INNER,
		SQUARE_CLOSE_BRACKET,
		COMPLETED
	}

	public static final Slot<State, Expression> CALLER = Slot.of(State.CALLER, Expression.class);
	public static final Slot<State, SquareOpenBracket> SQUARE_OPEN_BRACKET = Slot.of(State.SQUARE_OPEN_BRACKET, SquareOpenBracket.class);
	public static final Slot<State, Expression> INNER = Slot.of(State.INNER, Expression.class);
	public static final Slot<State, SquareCloseBracket> SQUARE_CLOSE_BRACKET = Slot.of(State.SQUARE_CLOSE_BRACKET, SquareCloseBracket.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	public IndexerExpression(Expression caller) {
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

	public Expression getInner() {
		return form.get(INNER);
	}

	public void setInner(Expression value) {
		form.set(INNER, value);
	}

	public SquareCloseBracket getSquareCloseBracket() {
		return form.get(SQUARE_CLOSE_BRACKET);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (form.getState()) {
			case SQUARE_OPEN_BRACKET:
				if (c == '[') {
					form.receive(SQUARE_OPEN_BRACKET, new SquareOpenBracket());
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
			case SQUARE_CLOSE_BRACKET:
				if (Chars.isSpace(c)) {
					readSpace(c, state);
					return;
				}
				if (c == ']') {
					form.receive(SQUARE_CLOSE_BRACKET, new SquareCloseBracket());
					return;
				}
				readInvalid(InvalidToken.until("]"), c, state);
				return;
			default:
				break;
		}
		state.popAndPass(c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		if (form.getState() == State.INNER || form.getState() == State.SQUARE_CLOSE_BRACKET) {
			readNewLine();
		} else {
			state.popAndPassNewLine();
		}
	}
}
