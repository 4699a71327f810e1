package gdreader.syntax.declarations;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Node;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.expressions.Expression;
import gdreader.syntax.expressions.ExpressionResolver;
import gdreader.syntax.tokens.Assign;
import gdreader.syntax.tokens.Identifier;

/**
 * <code>NAME</code> or <code>NAME = value</code> inside an enum.
 */
public final class EnumValue extends Node {

	public enum State {
		IDENTIFIER,
		ASSIGN,
		VALUE,
		COMPLETED
	}

	public static final Slot<State, Identifier> IDENTIFIER = Slot.of(State.IDENTIFIER, Identifier.class);
	public static final Slot<State, Assign> ASSIGN = Slot.of(State.ASSIGN, Assign.class);
	public static final Slot<State, Expression> VALUE = Slot.of(State.VALUE, Expression.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

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

	public Expression getValue() {
		return form.get(VALUE);
	}

	public void setValue(Expression value) {
		form.set(VALUE, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (form.getState()) {
			case IDENTIFIER:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, IDENTIFIER, new Identifier(), c, state);
					return;
				}
				form.skip(IDENTIFIER);
				handleChar(c, state);
				return;
			case ASSIGN:
				if (Chars.isSpace(c)) {
					readSpace(c, state);
					return;
				}
				if (c == '=') {
					form.receive(ASSIGN, new Assign());
					return;
				}
				form.complete();
				break;
			case VALUE:
				if (Chars.isSpace(c)) {
					readSpace(c, state);
					return;
				}
				if (Chars.isExpressionStart(c)) {
					state.push(new ExpressionResolver(form.receiver(VALUE), true));
					state.passChar(c);
					return;
				}
				form.skip(VALUE);
				break;
			default:
				break;
		}
		state.popAndPass(c);
	}
}
