package gdreader.syntax.expressions;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Node;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.Assign;
import gdreader.syntax.tokens.Colon;

/**
 * One entry of a dictionary: <code>key: value</code>, or <code>key = value</code>.
 */
public final class DictionaryKeyValue extends Node {

	public enum State {
		KEY,
		COLON,
		ASSIGN,
		VALUE,
		COMPLETED
	}

	public static final Slot<State, Expression> KEY = Slot.of(State.KEY, Expression.class);
	public static final Slot<State, Colon> COLON = Slot.of(State.COLON, Colon.class);
	public static final Slot<State, Assign> ASSIGN = Slot.of(State.ASSIGN, Assign.class);
	public static final Slot<State, Expression> VALUE = Slot.of(State.VALUE, Expression.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Expression getKey() {
		return form.get(KEY);
	}

	public void setKey(Expression value) {
		form.set(KEY, value);
	}

	public Colon getColon() {
		return form.get(COLON);
	}

	public Assign getAssign() {
		return form.get(ASSIGN);
	}

	public Expression getValue() {
		return form.get(VALUE);
	}

	public void setValue(Expression value) {
		form.set(VALUE, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (Chars.isSpace(c)) {
			readSpace(c, state);
			return;
		}
		switch (form.getState()) {
			case KEY:
				if (Chars.isExpressionStart(c)) {
					state.push(new ExpressionResolver(form.receiver(KEY), true, false));
					state.passChar(c);
					return;
				}
				form.skip(KEY);
				handleChar(c, state);
				return;
			case COLON:
				if (c == ':') {
					form.receive(COLON, new Colon());
					form.setState(State.VALUE);
					return;
				}
				form.skip(COLON);
				handleChar(c, state);
				return;
			case ASSIGN:
				if (c == '=') {
					form.receive(ASSIGN, new Assign());
					return;
				}
				form.skip(ASSIGN);
				form.skip(VALUE);
				break;
			case VALUE:
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

	@Override
	public void handleNewLineChar(ReadingState state) {
		if (form.isCompleted()) {
			state.popAndPassNewLine();
		} else {
			readNewLine();
		}
	}
}
