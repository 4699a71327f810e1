package gdreader.syntax.declarations;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.lists.EnumValuesList;
import gdreader.syntax.tokens.FigureCloseBracket;
import gdreader.syntax.tokens.FigureOpenBracket;
import gdreader.syntax.tokens.Identifier;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

/**
 * <code>enum Name { A, B = 2 }</code>; the name is optional and the values may span lines.
 */
public final class EnumDeclaration extends ClassMember {

	public enum State {
		ENUM,
		IDENTIFIER,
		FIGURE_OPEN_BRACKET,
		VALUES,
		FIGURE_CLOSE_BRACKET,
		COMPLETED
	}

	public static final Slot<State, Keyword> ENUM = Slot.of(State.ENUM, Keyword.class);
	public static final Slot<State, Identifier> IDENTIFIER = Slot.of(State.IDENTIFIER, Identifier.class);
	public static final Slot<State, FigureOpenBracket> FIGURE_OPEN_BRACKET = Slot.of(State.FIGURE_OPEN_BRACKET, FigureOpenBracket.class);
	public static final Slot<State, EnumValuesList> VALUES = Slot.of(State.VALUES, EnumValuesList.class);
	public static final Slot<State, FigureCloseBracket> FIGURE_CLOSE_BRACKET = Slot.of(State.FIGURE_CLOSE_BRACKET, FigureCloseBracket.class);

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

	public EnumValuesList getValues() {
		return form.getOrCreate(VALUES, EnumValuesList::new);
	}

	public void setValues(EnumValuesList value) {
		form.set(VALUES, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (Chars.isSpace(c) && form.getState() != State.ENUM && form.getState() != State.VALUES && !form.isCompleted()) {
			readSpace(c, state);
			return;
		}
		switch (form.getState()) {
			case ENUM:
				readKeyword(KeywordKind.ENUM, form.receiver(ENUM), c, state);
				return;
			case IDENTIFIER:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, IDENTIFIER, new Identifier(), c, state);
					return;
				}
				form.skip(IDENTIFIER);
				handleChar(c, state);
				return;
			case FIGURE_OPEN_BRACKET:
				if (c == '{') {
					form.receive(FIGURE_OPEN_BRACKET, new FigureOpenBracket());
					return;
				}
				form.complete();
				break;
			case VALUES:
				if (c == '}') {
					form.skip(VALUES);
					handleChar(c, state);
					return;
				}
				readInto(form, VALUES, new EnumValuesList(), c, state);
				return;
			case FIGURE_CLOSE_BRACKET:
				if (c == '}') {
					form.receive(FIGURE_CLOSE_BRACKET, new FigureCloseBracket());
					return;
				}
				form.skip(FIGURE_CLOSE_BRACKET);
				break;
			default:
				break;
		}
		state.popAndPass(c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		switch (form.getState()) {
			case VALUES:
				form.receive(VALUES, state.push(new EnumValuesList()));
				state.passNewLine();
				return;
			case FIGURE_CLOSE_BRACKET:
				readNewLine();
				return;
			default:
				form.complete();
				state.popAndPassNewLine();
				return;
		}
	}
}
