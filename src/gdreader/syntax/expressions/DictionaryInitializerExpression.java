package gdreader.syntax.expressions;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.lists.DictionaryKeyValuesList;
import gdreader.syntax.tokens.FigureCloseBracket;
import gdreader.syntax.tokens.FigureOpenBracket;

/**
 * <code>{key: value, other = value}</code>
 */
public final class DictionaryInitializerExpression extends Expression {

	public enum State {
		FIGURE_OPEN_BRACKET,
		VALUES,
		FIGURE_CLOSE_BRACKET,
		COMPLETED
	}

	public static final Slot<State, FigureOpenBracket> FIGURE_OPEN_BRACKET = Slot.of(State.FIGURE_OPEN_BRACKET, FigureOpenBracket.class);
	public static final Slot<State, DictionaryKeyValuesList> VALUES = Slot.of(State.VALUES, DictionaryKeyValuesList.class);
	public static final Slot<State, FigureCloseBracket> FIGURE_CLOSE_BRACKET = Slot.of(State.FIGURE_CLOSE_BRACKET, FigureCloseBracket.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public DictionaryKeyValuesList getValues() {
		return form.getOrCreate(VALUES, DictionaryKeyValuesList::new);
	}

	public void setValues(DictionaryKeyValuesList value) {
		form.set(VALUES, value);
	}

	public FigureCloseBracket getFigureCloseBracket() {
		return form.get(FIGURE_CLOSE_BRACKET);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (form.getState()) {
			case FIGURE_OPEN_BRACKET:
				if (c == '{') {
					form.receive(FIGURE_OPEN_BRACKET, new FigureOpenBracket());
					return;
				}
				form.complete();
				break;
			case VALUES:
				if (c != '}') {
					readInto(form, VALUES, new DictionaryKeyValuesList(), c, state);
					return;
				}
				form.skip(VALUES);
				handleChar(c, state);
				return;
			case FIGURE_CLOSE_BRACKET:
				if (Chars.isSpace(c)) {
					readSpace(c, state);
					return;
				}
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
		if (form.getState() == State.VALUES) {
			form.receive(VALUES, state.push(new DictionaryKeyValuesList()));
			state.passNewLine();
		} else if (form.getState() == State.FIGURE_CLOSE_BRACKET) {
			readNewLine();
		} else {
			state.popAndPassNewLine();
		}
	}
}
