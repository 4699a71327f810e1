package gdreader.syntax.tokens;

/**
 * Prefix operators with their binding priority, on the same scale as {@link DualOperatorType}.
 */
public enum SingleOperatorType {
	AWAIT("await", 18),
	BITWISE_NEGATE("~", 15),
	NEGATE("-", 14),
	NOT("!", 5),
	NOT_WORD("not", 5);

	private final String sequence;
	private final int priority;

	SingleOperatorType(String sequence, int priority) {
		this.sequence = sequence;
		this.priority = priority;
	}

	public String getSequence() {
		return sequence;
	}

	public int getPriority() {
		return priority;
	}

	/**
	 * The prefix operator written as a word, or null.
	 */
	public static SingleOperatorType byWord(String word) {
		if (word.equals(NOT_WORD.sequence)) {
			return NOT_WORD;
		}
		if (word.equals(AWAIT.sequence)) {
			return AWAIT;
		}
		return null;
	}

	public static SingleOperatorType byChar(char c) {
		switch (c) {
			case '~':
				return BITWISE_NEGATE;
			case '-':
				return NEGATE;
			case '!':
				return NOT;
			default:
				return null;
		}
	}
}
