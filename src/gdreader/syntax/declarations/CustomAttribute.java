package gdreader.syntax.declarations;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.lists.ExpressionsList;
import gdreader.syntax.tokens.At;
import gdreader.syntax.tokens.CloseBracket;
import gdreader.syntax.tokens.Identifier;
import gdreader.syntax.tokens.InvalidToken;
import gdreader.syntax.tokens.OpenBracket;

/**
 * An annotation such as <code>@tool</code>, <code>@onready</code> or <code>@export_range(0, 10)</code>.
 * The member it annotates may follow on the same line; it is read as a separate member.
 */
public final class CustomAttribute extends ClassMember {

	public enum State {
		AT,
		NAME,
		OPEN_BRACKET,
		PARAMETERS,
		CLOSE_BRACKET,
		COMPLETED
	}

	public static final Slot<State, At> AT = Slot.of(State.AT, At.class);
	public static final Slot<State, Identifier> NAME = Slot.of(State.NAME, Identifier.class);
	public static final Slot<State, OpenBracket> OPEN_BRACKET = Slot.of(State.OPEN_BRACKET, OpenBracket.class);
	public static final Slot<State, ExpressionsList> PARAMETERS = Slot.of(State.PARAMETERS, ExpressionsList.class);
	public static final Slot<State, CloseBracket> CLOSE_BRACKET = Slot.of(State.CLOSE_BRACKET, CloseBracket.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public At getAt() {
		return form.get(AT);
	}

	public Identifier getName() {
		return form.get(NAME);
	}

	public void setName(Identifier value) {
		form.set(NAME, value);
	}

	public OpenBracket getOpenBracket() {
		return form.get(OPEN_BRACKET);
	}

	public ExpressionsList getParameters() {
		return form.getOrCreate(PARAMETERS, () -> new ExpressionsList(true));
	}

	public void setParameters(ExpressionsList value) {
		form.set(PARAMETERS, value);
	}

	public CloseBracket getCloseBracket() {
		return form.get(CLOSE_BRACKET);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (form.getState()) {
			case AT:
				if (c == '@') {
					form.receive(AT, new At());
					return;
				}
				form.skip(AT);
				handleChar(c, state);
				return;
			case NAME:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, NAME, new Identifier(), c, state);
					return;
				}
				form.skip(NAME);
				handleChar(c, state);
				return;
			case OPEN_BRACKET:
				if (c == '(') {
					form.receive(OPEN_BRACKET, new OpenBracket());
					return;
				}
				form.complete();
				break;
			case PARAMETERS:
				if (c == ')') {
					form.skip(PARAMETERS);
					handleChar(c, state);
					return;
				}
				readInto(form, PARAMETERS, new ExpressionsList(true), c, state);
				return;
			case CLOSE_BRACKET:
				if (Chars.isSpace(c)) {
					readSpace(c, state);
					return;
				}
				if (c == ')') {
					form.receive(CLOSE_BRACKET, new CloseBracket());
					return;
				}
				readInvalid(InvalidToken.until(")"), c, state);
				return;
			default:
				break;
		}
		state.popAndPass(c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		switch (form.getState()) {
			case PARAMETERS:
				form.receive(PARAMETERS, state.push(new ExpressionsList(true)));
				state.passNewLine();
				break;
			case CLOSE_BRACKET:
				readNewLine();
				break;
			default:
				form.complete();
				state.popAndPassNewLine();
				break;
		}
	}
}
