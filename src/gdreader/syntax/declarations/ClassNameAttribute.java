package gdreader.syntax.declarations;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.Identifier;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

/**
 * <code>class_name Name</code>
 */
public final class ClassNameAttribute extends ClassMember {

	public enum State {
		CLASS_NAME,
		NAME,
		COMPLETED
	}

	public static final Slot<State, Keyword> CLASS_NAME = Slot.of(State.CLASS_NAME, Keyword.class);
	public static final Slot<State, Identifier> NAME = Slot.of(State.NAME, Identifier.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Identifier getName() {
		return form.get(NAME);
	}

	public void setName(Identifier value) {
		form.set(NAME, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (form.getState()) {
			case CLASS_NAME:
				readKeyword(KeywordKind.CLASS_NAME, form.receiver(CLASS_NAME), c, state);
				return;
			case NAME:
				if (Chars.isSpace(c)) {
					readSpace(c, state);
					return;
				}
				if (Chars.isIdentifierStart(c)) {
					readInto(form, NAME, new Identifier(), c, state);
					return;
				}
				form.skip(NAME);
				break;
			default:
				break;
		}
		state.popAndPass(c);
	}
}
