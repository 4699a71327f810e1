package gdreader.syntax.statements;

import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.declarations.VariableDeclaration;

/**
 * A local <code>var</code> or <code>const</code>; it reads exactly like a class level one.
 */
public final class VariableDeclarationStatement extends Statement {

	public enum State {
		DECLARATION,
		COMPLETED
	}

	public static final Slot<State, VariableDeclaration> DECLARATION = Slot.of(State.DECLARATION, VariableDeclaration.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public VariableDeclaration getDeclaration() {
		return form.get(DECLARATION);
	}

	public void setDeclaration(VariableDeclaration value) {
		form.set(DECLARATION, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (form.getState() == State.DECLARATION) {
			readInto(form, DECLARATION, new VariableDeclaration(), c, state);
			return;
		}
		state.popAndPass(c);
	}
}
