package gdreader.syntax.declarations;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.lists.ParametersList;
import gdreader.syntax.tokens.CloseBracket;
import gdreader.syntax.tokens.Identifier;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;
import gdreader.syntax.tokens.OpenBracket;

/**
 * <code>signal name(parameters)</code>; the parameter list is optional.
 */
public final class SignalDeclaration extends ClassMember {

	public enum State {
		SIGNAL,
		IDENTIFIER,
		OPEN_BRACKET,
		PARAMETERS,
		CLOSE_BRACKET,
		COMPLETED
	}

	public static final Slot<State, Keyword> SIGNAL = Slot.of(State.SIGNAL, Keyword.class);
	public static final Slot<State, Identifier> IDENTIFIER = Slot.of(State.IDENTIFIER, Identifier.class);
	public static final Slot<State, OpenBracket> OPEN_BRACKET = Slot.of(State.OPEN_BRACKET, OpenBracket.class);
	public static final Slot<State, ParametersList> PARAMETERS = Slot.of(State.PARAMETERS, ParametersList.class);
	public static final Slot<State, CloseBracket> CLOSE_BRACKET = Slot.of(State.CLOSE_BRACKET, CloseBracket.class);

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

	public ParametersList getParameters() {
		return form.getOrCreate(PARAMETERS, ParametersList::new);
	}

	public void setParameters(ParametersList value) {
		form.set(PARAMETERS, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (form.getState()) {
			case SIGNAL:
				readKeyword(KeywordKind.SIGNAL, form.receiver(SIGNAL), c, state);
				return;
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
				readInto(form, PARAMETERS, new ParametersList(), c, state);
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
				form.skip(CLOSE_BRACKET);
				break;
			default:
				break;
		}
		state.popAndPass(c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		switch (form.getState()) {
			case PARAMETERS:
				form.receive(PARAMETERS, state.push(new ParametersList()));
				state.passNewLine();
				return;
			case CLOSE_BRACKET:
				readNewLine();
				return;
			default:
				form.complete();
				state.popAndPassNewLine();
				return;
		}
	}
}
