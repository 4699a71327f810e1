package gdreader.syntax.expressions;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.Identifier;
import gdreader.syntax.tokens.Point;

/**
 * <code>caller.member</code>
 */
public final class MemberOperatorExpression extends Expression {

	public enum State {
		CALLER,
		POINT,
		IDENTIFIER,
		COMPLETED
	}

	public static final Slot<State, Expression> CALLER = Slot.of(State.CALLER, Expression.class);
	public static final Slot<State, Point> POINT = Slot.of(State.POINT, Point.class);
	public static final Slot<State, Identifier> IDENTIFIER = Slot.of(State.IDENTIFIER, Identifier.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	public MemberOperatorExpression(Expression caller) {
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

	public Identifier getIdentifier() {
		return form.get(IDENTIFIER);
	}

	public void setIdentifier(Identifier value) {
		form.set(IDENTIFIER, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (form.getState()) {
			case POINT:
				if (c == '.') {
					form.receive(POINT, new Point());
					return;
				}
				form.complete();
				break;
			case IDENTIFIER:
				if (Chars.isSpace(c)) {
					readSpace(c, state);
					return;
				}
				if (Chars.isIdentifierStart(c)) {
					readInto(form, IDENTIFIER, new Identifier(), c, state);
					return;
				}
				form.skip(IDENTIFIER);
				break;
			default:
				break;
		}
		state.popAndPass(c);
	}
}
