package gdreader.syntax;

import gdreader.InvalidReadingStateError;

/**
 * Stores a received child in one slot of a form and moves the form to the next state.
 * Both callbacks refuse to run once the form has moved past the slot.
 */
public final class SlotReceiver<S extends Enum<S>, T extends SyntaxToken> implements TokenReceiver<T> {

	private final TokensForm<S> form;
	private final Slot<S, T> slot;
	private final S next;

	SlotReceiver(TokensForm<S> form, Slot<S, T> slot, S next) {
		this.form = form;
		this.slot = slot;
		this.next = next;
	}

	@Override
	public void handleReceivedToken(T token) {
		checkState();
		form.set(slot, token);
		form.setState(next);
	}

	@Override
	public void handleReceivedTokenSkip() {
		checkState();
		form.setState(next);
	}

	private void checkState() {
		if (!form.isOrLowerState(slot.getState())) {
			throw new InvalidReadingStateError(slot.getState(), form.getState());
		}
	}
}
