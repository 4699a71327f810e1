package gdreader.syntax;

/**
 * A named, typed position inside a {@link TokensForm}. The state constant doubles as the slot index.
 */
public final class Slot<S extends Enum<S>, T extends SyntaxToken> {

	private final S state;
	private final Class<T> type;

	private Slot(S state, Class<T> type) {
		this.state = state;
		this.type = type;
	}

	public static <S extends Enum<S>, T extends SyntaxToken> Slot<S, T> of(S state, Class<T> type) {
		return new Slot<>(state, type);
	}

	public S getState() {
		return state;
	}

	public Class<T> getType() {
		return type;
	}

	public int index() {
		return state.ordinal();
	}

	@Override
	public String toString() {
		return state + ":" + type.getSimpleName();
	}
}
