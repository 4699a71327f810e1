package gdreader.syntax.expressions;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.Identifier;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

/**
 * A match pattern that binds the matched value to a new name: <code>var x</code>.
 */
public final class BindingPatternExpression extends Expression {

	public enum State {
		VAR,
		IDENTIFIER,
		COMPLETED
	}

	public static final Slot<State, Keyword> VAR = Slot.of(State.VAR, Keyword.class);
	public static final Slot<State, Identifier> IDENTIFIER = Slot.of(State.IDENTIFIER, Identifier.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	public BindingPatternExpression() {
		form.receive(VAR, new Keyword(KeywordKind.VAR));
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
		if (form.getState() == State.IDENTIFIER) {
			if (Chars.isSpace(c)) {
				readSpace(c, state);
				return;
			}
			if (Chars.isIdentifierStart(c)) {
				readInto(form, IDENTIFIER, new Identifier(), c, state);
				return;
			}
			form.skip(IDENTIFIER);
		}
		state.popAndPass(c);
	}
}
