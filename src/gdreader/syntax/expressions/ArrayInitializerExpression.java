package gdreader.syntax.expressions;

import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.lists.ExpressionsList;
import gdreader.syntax.tokens.SquareCloseBracket;
import gdreader.syntax.tokens.SquareOpenBracket;

/**
 * <code>[a, b, c]</code>
 */
public final class ArrayInitializerExpression extends Expression {

	public enum State {
		SQUARE_OPEN_BRACKET,
		VALUES,
		SQUARE_CLOSE_BRACKET,
		COMPLETED
	}

	public static final Slot<State, SquareOpenBracket> SQUARE_OPEN_BRACKET = Slot.of(State.SQUARE_OPEN_BRACKET, SquareOpenBracket.class);
	public static final Slot<State, ExpressionsList> VALUES = Slot.of(State.VALUES, ExpressionsList.class);
	public static final Slot<State, SquareCloseBracket> SQUARE_CLOSE_BRACKET = Slot.of(State.SQUARE_CLOSE_BRACKET, SquareCloseBracket.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public ExpressionsList getValues() {
		return form.getOrCreate(VALUES, () -> new ExpressionsList(true));
	}

	public void setValues(ExpressionsList value) {
		form.set(VALUES, value);
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
			case VALUES:
				if (c != ']') {
					readInto(form, VALUES, new ExpressionsList(true), c, state);
					return;
				}
				form.skip(VALUES);
				handleChar(c, state);
				return;
			case SQUARE_CLOSE_BRACKET:
				if (c == ']') {
					form.receive(SQUARE_CLOSE_BRACKET, new SquareCloseBracket());
					return;
				}
				form.skip(SQUARE_CLOSE_BRACKET);
				break;
			default:
				break;
		}
		state.popAndPass(c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		if (form.getState() == State.VALUES) {
			form.receive(VALUES, state.push(new ExpressionsList(true)));
			state.passNewLine();
		} else if (form.getState() == State.SQUARE_CLOSE_BRACKET) {
			readNewLine();
		} else {
			state.popAndPassNewLine();
		}
	}
}
