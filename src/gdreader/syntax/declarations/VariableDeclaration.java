package gdreader.syntax.declarations;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.expressions.Expression;
import gdreader.syntax.expressions.ExpressionResolver;
import gdreader.syntax.lists.PropertyAccessorsList;
import gdreader.syntax.tokens.Assign;
import gdreader.syntax.tokens.Colon;
import gdreader.syntax.tokens.Identifier;
import gdreader.syntax.tokens.InvalidToken;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

/**
 * <code>var name: Type = value</code> or <code>const NAME = value</code>. With <code>:=</code> the
 * type slot stays empty. A class variable may be <code>static</code>.
 *
 * Property accessors follow a colon at the end of the declaration, on the same line
 * (<code>var hp = 10: get = get_hp</code>) or as an indented block of <code>get:</code> and
 * <code>set(value):</code> bodies. In <code>var hp:</code> directly followed by the block, the
 * colon stays in the type colon slot and the type is absent.
 */
public final class VariableDeclaration extends ClassMember {

	public enum State {
		STATIC,
		CONST,
		VAR,
		IDENTIFIER,
		TYPE_COLON,
		TYPE,
		ASSIGN,
		INITIALIZER,
		ACCESSORS_COLON,
		ACCESSORS,
		COMPLETED
	}

	public static final Slot<State, Keyword> STATIC = Slot.of(State.STATIC, Keyword.class);
	public static final Slot<State, Keyword> CONST = Slot.of(State.CONST, Keyword.class);
	public static final Slot<State, Keyword> VAR = Slot.of(State.VAR, Keyword.class);
	public static final Slot<State, Identifier> IDENTIFIER = Slot.of(State.IDENTIFIER, Identifier.class);
	public static final Slot<State, Colon> TYPE_COLON = Slot.of(State.TYPE_COLON, Colon.class);
	public static final Slot<State, TypeNode> TYPE = Slot.of(State.TYPE, TypeNode.class);
	public static final Slot<State, Assign> ASSIGN = Slot.of(State.ASSIGN, Assign.class);
	public static final Slot<State, Expression> INITIALIZER = Slot.of(State.INITIALIZER, Expression.class);
	public static final Slot<State, Colon> ACCESSORS_COLON = Slot.of(State.ACCESSORS_COLON, Colon.class);
	public static final Slot<State, PropertyAccessorsList> ACCESSORS = Slot.of(State.ACCESSORS, PropertyAccessorsList.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public boolean isStatic() {
		return form.get(STATIC) != null;
	}

	public boolean isConstant() {
		return form.get(CONST) != null;
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

	public Expression getInitializer() {
		return form.get(INITIALIZER);
	}

	public void setInitializer(Expression value) {
		form.set(INITIALIZER, value);
	}

	/**
	 * The accessors of a property, or null for a plain variable.
	 */
	public PropertyAccessorsList getAccessors() {
		return form.get(ACCESSORS);
	}

	public void setAccessors(PropertyAccessorsList value) {
		form.set(ACCESSORS, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (Chars.isSpace(c) && form.getState().ordinal() > State.VAR.ordinal() && !form.isCompleted()) {
			readSpace(c, state);
			return;
		}
		if (Chars.isSpace(c) && form.get(STATIC) != null && form.getState() == State.VAR) {
			readSpace(c, state);
			return;
		}
		switch (form.getState()) {
			case STATIC:
				if (c == 's') {
					readKeyword(KeywordKind.STATIC, form.receiver(STATIC, State.VAR), c, state);
					return;
				}
				form.skip(STATIC);
				handleChar(c, state);
				return;
			case CONST:
				if (c == 'c') {
					readKeyword(KeywordKind.CONST, form.receiver(CONST, State.IDENTIFIER), c, state);
					return;
				}
				form.skip(CONST);
				handleChar(c, state);
				return;
			case VAR:
				readKeyword(KeywordKind.VAR, form.receiver(VAR), c, state);
				return;
			case IDENTIFIER:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, IDENTIFIER, new Identifier(), c, state);
					return;
				}
				form.skip(IDENTIFIER);
				form.complete();
				readInvalid(InvalidToken.untilLineEnd(), c, state);
				return;
			case TYPE_COLON:
				if (c == ':') {
					form.receive(TYPE_COLON, new Colon());
					return;
				}
				form.skip(TYPE_COLON);
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
				form.skip(ASSIGN);
				form.skip(INITIALIZER);
				handleChar(c, state);
				return;
			case INITIALIZER:
				if (Chars.isExpressionStart(c)) {
					state.push(new ExpressionResolver(form.receiver(INITIALIZER)));
					state.passChar(c);
					return;
				}
				form.skip(INITIALIZER);
				handleChar(c, state);
				return;
			case ACCESSORS_COLON:
				if (c == ':') {
					form.receive(ACCESSORS_COLON, new Colon());
					return;
				}
				form.complete();
				break;
			case ACCESSORS:
				readInto(form, ACCESSORS, new PropertyAccessorsList(state.getLineColumn()), c, state);
				return;
			default:
				break;
		}
		state.popAndPass(c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		if (form.getState() == State.ACCESSORS || (form.getState() == State.TYPE && form.get(TYPE_COLON) != null)) {
			form.setState(State.ACCESSORS);
			form.receive(ACCESSORS, state.push(new PropertyAccessorsList(state.getLineColumn())));
			state.passNewLine();
			return;
		}
		form.complete();
		state.popAndPassNewLine();
	}

	// without an accessor colon the declaration is over once its value is read

	@Override
	public void handleSharpChar(ReadingState state) {
		if (form.getState() == State.ACCESSORS_COLON) {
			form.complete();
		}
		super.handleSharpChar(state);
	}

	@Override
	public void handleCarriageReturnChar(ReadingState state) {
		if (form.getState() == State.ACCESSORS_COLON) {
			form.complete();
		}
		super.handleCarriageReturnChar(state);
	}
}
