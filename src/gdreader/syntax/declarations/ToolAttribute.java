package gdreader.syntax.declarations;

import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

public final class ToolAttribute extends ClassMember {

	public enum State {
		TOOL,
		COMPLETED
	}

	public static final Slot<State, Keyword> TOOL = Slot.of(State.TOOL, Keyword.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Keyword getTool() {
		return form.get(TOOL);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (form.getState() == State.TOOL) {
			readKeyword(KeywordKind.TOOL, form.receiver(TOOL), c, state);
			return;
		}
		state.popAndPass(c);
	}
}
