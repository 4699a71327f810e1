package gdreader.syntax.declarations;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Node;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.lists.StatementsList;
import gdreader.syntax.tokens.Assign;
import gdreader.syntax.tokens.CloseBracket;
import gdreader.syntax.tokens.Colon;
import gdreader.syntax.tokens.Identifier;
import gdreader.syntax.tokens.InvalidToken;
import gdreader.syntax.tokens.OpenBracket;

/**
 * One accessor of a property: <code>get:</code> or <code>set(value):</code> with a body, or
 * <code>get = method_name</code>.
 */
public final class PropertyAccessor extends Node {

	public static final String GET = "get";
	public static final String SET = "set";

	public enum State {
		NAME,
		OPEN_BRACKET,
		PARAMETER,
		CLOSE_BRACKET,
		ASSIGN,
		METHOD,
		COLON,
		STATEMENTS,
		COMPLETED
	}

	public static final Slot<State, Identifier> NAME = Slot.of(State.NAME, Identifier.class);
	public static final Slot<State, OpenBracket> OPEN_BRACKET = Slot.of(State.OPEN_BRACKET, OpenBracket.class);
	public static final Slot<State, Identifier> PARAMETER = Slot.of(State.PARAMETER, Identifier.class);
	public static final Slot<State, CloseBracket> CLOSE_BRACKET = Slot.of(State.CLOSE_BRACKET, CloseBracket.class);
	public static final Slot<State, Assign> ASSIGN = Slot.of(State.ASSIGN, Assign.class);
	public static final Slot<State, Identifier> METHOD = Slot.of(State.METHOD, Identifier.class);
	public static final Slot<State, Colon> COLON = Slot.of(State.COLON, Colon.class);
	public static final Slot<State, StatementsList> STATEMENTS = Slot.of(State.STATEMENTS, StatementsList.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);
	private final int intendation;

	public PropertyAccessor(int intendation) {
		this.intendation = intendation;
	}

	public static boolean isAccessorName(String word) {
		return word.equals(GET) || word.equals(SET);
	}

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Identifier getName() {
		return form.get(NAME);
	}

	public boolean isGetter() {
		Identifier name = getName();
		return name != null && name.getSequence().equals(GET);
	}

	public boolean isSetter() {
		Identifier name = getName();
		return name != null && name.getSequence().equals(SET);
	}

	/**
	 * Name of the setter's value parameter.
	 */
	public Identifier getParameter() {
		return form.get(PARAMETER);
	}

	/**
	 * The method that implements the accessor, when it is named instead of written out.
	 */
	public Identifier getMethod() {
		return form.get(METHOD);
	}

	public StatementsList getStatements() {
		return form.get(STATEMENTS);
	}

	public void setStatements(StatementsList value) {
		form.set(STATEMENTS, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (Chars.isSpace(c) && form.getState() != State.NAME && !form.isCompleted()) {
			readSpace(c, state);
			return;
		}
		switch (form.getState()) {
			case NAME:
				readInto(form, NAME, new Identifier(), c, state);
				return;
			case OPEN_BRACKET:
				if (c == '(') {
					form.receive(OPEN_BRACKET, new OpenBracket());
					return;
				}
				form.skip(OPEN_BRACKET);
				form.skip(PARAMETER);
				form.skip(CLOSE_BRACKET);
				handleChar(c, state);
				return;
			case PARAMETER:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, PARAMETER, new Identifier(), c, state);
					return;
				}
				form.skip(PARAMETER);
				handleChar(c, state);
				return;
			case CLOSE_BRACKET:
				if (c == ')') {
					form.receive(CLOSE_BRACKET, new CloseBracket());
					return;
				}
				form.skip(CLOSE_BRACKET);
				handleChar(c, state);
				return;
			case ASSIGN:
				if (c == '=') {
					form.receive(ASSIGN, new Assign());
					return;
				}
				form.skip(ASSIGN);
				form.skip(METHOD);
				handleChar(c, state);
				return;
			case METHOD:
				if (Chars.isIdentifierStart(c)) {
					form.receiver(METHOD, State.COMPLETED).handleReceivedToken(new Identifier());
					state.push(form.get(METHOD));
					state.passChar(c);
					return;
				}
				form.complete();
				break;
			case COLON:
				if (c == ':') {
					form.receive(COLON, new Colon());
					return;
				}
				form.skip(COLON);
				handleChar(c, state);
				return;
			case STATEMENTS:
				if (form.get(COLON) == null) {
					readInvalid(InvalidToken.untilLineEnd(), c, state);
					return;
				}
				readInto(form, STATEMENTS, new StatementsList(intendation), c, state);
				return;
			default:
				break;
		}
		state.popAndPass(c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		if (form.getState() == State.STATEMENTS && form.get(COLON) != null) {
			form.receive(STATEMENTS, state.push(new StatementsList(intendation)));
			state.passNewLine();
			return;
		}
		form.complete();
		state.popAndPassNewLine();
	}
}
