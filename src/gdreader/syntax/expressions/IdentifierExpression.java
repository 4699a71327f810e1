package gdreader.syntax.expressions;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.Identifier;

public final class IdentifierExpression extends Expression {

	public enum State {
		IDENTIFIER,
		COMPLETED
	}

	public static final Slot<State, Identifier> IDENTIFIER = Slot.of(State.IDENTIFIER, Identifier.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	public IdentifierExpression() {
	}

	public IdentifierExpression(Identifier identifier) {
		form.receive(IDENTIFIER, identifier);
	}

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Identifier getIdentifier() {
		return form.get(IDENTIFIER);
	}

	public void setIdentifier(Identifier value) {
		form.set(IDENTIFIER, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (form.getState() == State.IDENTIFIER && Chars.isIdentifierStart(c)) {
			readInto(form, IDENTIFIER, new Identifier(), c, state);
			return;
		}
		form.complete();
		state.popAndPass(c);
	}
}
