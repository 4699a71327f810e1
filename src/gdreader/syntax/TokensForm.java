package gdreader.syntax;

import gdreader.InternalParserError;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Fixed-arity children of a node. Every constant of the state enum except the last one names a
 * slot; the last constant means the node is completed. Incidental tokens are kept in front of the
 * slot that was expected when they were read.
 */
public final class TokensForm<S extends Enum<S>> extends AbstractTokensForm {

	private final S[] states;
	private final SyntaxToken[] slots;
	private final boolean[] assigned;
	private final List<List<SyntaxToken>> before;
	private final List<SyntaxToken> trailing = new ArrayList<>();
	private S state;

	public TokensForm(Node owner, Class<S> stateType) {
		super(owner);
		this.states = stateType.getEnumConstants();
		if (states.length == 0) {
			throw new InternalParserError("state enum " + stateType.getSimpleName() + " has no constants");
		}
		this.slots = new SyntaxToken[states.length - 1];
		this.assigned = new boolean[slots.length];
		this.before = new ArrayList<>(slots.length);
		for (int i = 0; i < slots.length; i++) {
			before.add(null);
		}
		this.state = states[0];
	}

	public S getState() {
		return state;
	}

	public void setState(S state) {
		this.state = state;
	}

	/**
	 * True while the form has not moved past the given state.
	 */
	public boolean isOrLowerState(S s) {
		return state.ordinal() <= s.ordinal();
	}

	public boolean isCompleted() {
		return state.ordinal() == slots.length;
	}

	public void complete() {
		state = states[slots.length];
	}

	public S nextState(S s) {
		return states[Math.min(s.ordinal() + 1, slots.length)];
	}

	public <T extends SyntaxToken> T get(Slot<S, T> slot) {
		return slot.getType().cast(slots[slot.index()]);
	}

	public SyntaxToken get(int index) {
		return slots[index];
	}

	public <T extends SyntaxToken> void set(Slot<S, T> slot, T value) {
		int i = slot.index();
		SyntaxToken old = slots[i];
		if (old == value) {
			assigned[i] = true;
			return;
		}
		slots[i] = null;
		detach(old);
		attach(value);
		slots[i] = value;
		assigned[i] = true;
	}

	/**
	 * Returns the slot value, materializing a default if the slot was never assigned. A slot that was
	 * explicitly set to null stays null.
	 */
	public <T extends SyntaxToken> T getOrCreate(Slot<S, T> slot, Supplier<T> factory) {
		int i = slot.index();
		if (!assigned[i]) {
			set(slot, factory.get());
		}
		return get(slot);
	}

	public <T extends SyntaxToken> TokenReceiver<T> receiver(Slot<S, T> slot) {
		return new SlotReceiver<>(this, slot, nextState(slot.getState()));
	}

	public <T extends SyntaxToken> TokenReceiver<T> receiver(Slot<S, T> slot, S next) {
		return new SlotReceiver<>(this, slot, next);
	}

	/**
	 * Delivers a token to a slot through the receiver protocol.
	 */
	public <T extends SyntaxToken> void receive(Slot<S, T> slot, T token) {
		receiver(slot).handleReceivedToken(token);
	}

	/**
	 * Reports a slot as absent through the receiver protocol.
	 */
	public <T extends SyntaxToken> void skip(Slot<S, T> slot) {
		receiver(slot).handleReceivedTokenSkip();
	}

	@Override
	public void addBeforeActive(SyntaxToken token) {
		addBefore(state, token);
	}

	public void addBefore(S s, SyntaxToken token) {
		attach(token);
		int i = s.ordinal();
		if (i >= slots.length) {
			trailing.add(token);
			return;
		}
		List<SyntaxToken> list = before.get(i);
		if (list == null) {
			list = new ArrayList<>();
			before.set(i, list);
		}
		list.add(token);
	}

	@Override
	public void addToEnd(SyntaxToken token) {
		attach(token);
		trailing.add(token);
	}

	@Override
	public boolean remove(SyntaxToken token) {
		for (int i = 0; i < slots.length; i++) {
			if (slots[i] == token) {
				slots[i] = null;
				detach(token);
				return true;
			}
			List<SyntaxToken> list = before.get(i);
			if (list != null && removeByIdentity(list, token)) {
				detach(token);
				return true;
			}
		}
		if (removeByIdentity(trailing, token)) {
			detach(token);
			return true;
		}
		return false;
	}

	private static boolean removeByIdentity(List<SyntaxToken> list, SyntaxToken token) {
		for (int i = 0; i < list.size(); i++) {
			if (list.get(i) == token) {
				list.remove(i);
				return true;
			}
		}
		return false;
	}

	@Override
	public int size() {
		int size = trailing.size();
		for (int i = 0; i < slots.length; i++) {
			List<SyntaxToken> list = before.get(i);
			if (list != null) {
				size += list.size();
			}
			if (slots[i] != null) {
				size++;
			}
		}
		return size;
	}

	@Override
	public Iterator<SyntaxToken> iterator() {
		return new Iterator<SyntaxToken>() {
			private int slot = 0;
			private int index = 0;
			private boolean atSlot = false;
			private SyntaxToken next = advance();

			private SyntaxToken advance() {
				while (slot < slots.length) {
					if (!atSlot) {
						List<SyntaxToken> list = before.get(slot);
						if (list != null && index < list.size()) {
							return list.get(index++);
						}
						atSlot = true;
						index = 0;
					}
					SyntaxToken value = slots[slot];
					slot++;
					atSlot = false;
					if (value != null) {
						return value;
					}
				}
				if (index < trailing.size()) {
					return trailing.get(index++);
				}
				return null;
			}

			@Override
			public boolean hasNext() {
				return next != null;
			}

			@Override
			public SyntaxToken next() {
				if (next == null) {
					throw new NoSuchElementException();
				}
				SyntaxToken current = next;
				next = advance();
				return current;
			}
		};
	}
}
