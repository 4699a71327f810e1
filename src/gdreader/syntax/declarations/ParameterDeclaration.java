package gdreader.syntax.declarations;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Node;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.expressions.Expression;
import gdreader.syntax.expressions.ExpressionResolver;
import gdreader.syntax.tokens.Assign;
import gdreader.syntax.tokens.Colon;
import gdreader.syntax.tokens.Identifier;

/**
 * <code>name: Type = default</code> in a method or signal signature.
 */
public final class ParameterDeclaration extends Node {

	public enum State {
		IDENTIFIER,
		COLON,
		TYPE,
		ASSIGN,
		DEFAULT_VALUE,
		COMPLETED
	}

	public static final Slot<State, Identifier> IDENTIFIER = Slot.of(State.IDENTIFIER, Identifier.class);
	public static final Slot<State, Colon> COLON = Slot.of(State.COLON, Colon.class);
	public static final Slot<State, TypeNode> TYPE = Slot.of(State.TYPE, TypeNode.class);
	public static final Slot<State, Assign> ASSIGN = Slot.of(State.ASSIGN, Assign.class);
	public static final Slot<State, Expression> DEFAULT_VALUE = Slot.of(State.DEFAULT_VALUE, Expression.class);

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

	public TypeNode getType() {
		return form.get(TYPE);
	}

	public void setType(TypeNode value) {
		form.set(TYPE, value);
	}

	public Expression getDefaultValue() {
		return form.get(DEFAULT_VALUE);
	}

	public void setDefaultValue(Expression value) {
		form.set(DEFAULT_VALUE, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (Chars.isSpace(c) && form.getState() != State.IDENTIFIER && !form.isCompleted()) {
			readSpace(c, state);
			return;
		}
		switch (form.getState()) {
			case IDENTIFIER:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, IDENTIFIER, new Identifier(), c, state);
					return;
				}
				form.skip(IDENTIFIER);
				handleChar(c, state);
				return;
			case COLON:
				if (c == ':') {
					form.receive(COLON, new Colon());
					return;
				}
				form.skip(COLON);
				form.skip(TYPE);
				handleChar(c, state);
				return;
			case TYPE:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, TYPE, new TypeNode(), c, state);
					return;
				}
				form.skip(TYPE);
				handleChar(c, state);
				return;
			case ASSIGN:
				if (c == '=') {
					form.receive(ASSIGN, new Assign());
					return;
				}
				form.complete();
				break;
			case DEFAULT_VALUE:
				if (Chars.isExpressionStart(c)) {
					state.push(new ExpressionResolver(form.receiver(DEFAULT_VALUE), true));
					state.passChar(c);
					return;
				}
				form.skip(DEFAULT_VALUE);
				break;
			default:
				break;
		}
		state.popAndPass(c);
	}
}
