package gdreader.syntax.expressions;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.NumberToken;

public final class NumberExpression extends Expression {

	public enum State {
		NUMBER,
		COMPLETED
	}

	public static final Slot<State, NumberToken> NUMBER = Slot.of(State.NUMBER, NumberToken.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public NumberToken getNumber() {
		return form.get(NUMBER);
	}

	public void setNumber(NumberToken value) {
		form.set(NUMBER, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (form.getState() == State.NUMBER && Chars.isDigit(c)) {
			readInto(form, NUMBER, new NumberToken(), c, state);
			return;
		}
		form.complete();
		state.popAndPass(c);
	}
}
