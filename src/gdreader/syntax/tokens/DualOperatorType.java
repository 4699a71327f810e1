package gdreader.syntax.tokens;

/**
 * Binary operators with their binding priority (higher binds tighter). The two-word operators are
 * written with a single space between the words.
 */
public enum DualOperatorType {
	IS("is", 17),
	IS_NOT("is not", 17),
	POWER("**", 16),
	MULTIPLY("*", 13),
	DIVIDE("/", 13),
	MOD("%", 13),
	ADD("+", 12),
	SUBTRACT("-", 12),
	BIT_SHIFT_LEFT("<<", 11),
	BIT_SHIFT_RIGHT(">>", 11),
	BITWISE_AND("&", 10),
	XOR("^", 9),
	BITWISE_OR("|", 8),
	EQUAL("==", 7),
	NOT_EQUAL("!=", 7),
	LESS("<", 7),
	LESS_OR_EQUAL("<=", 7),
	MORE(">", 7),
	MORE_OR_EQUAL(">=", 7),
	IN("in", 6),
	NOT_IN("not in", 6),
	AND("and", 4),
	AND2("&&", 4),
	OR("or", 3),
	OR2("||", 3),
	AS("as", 1),
	ASSIGNMENT("=", 0),
	ADD_AND_ASSIGN("+=", 0),
	SUBTRACT_AND_ASSIGN("-=", 0),
	MULTIPLY_AND_ASSIGN("*=", 0),
	DIVIDE_AND_ASSIGN("/=", 0),
	MOD_AND_ASSIGN("%=", 0),
	POWER_AND_ASSIGN("**=", 0),
	BIT_SHIFT_LEFT_AND_ASSIGN("<<=", 0),
	BIT_SHIFT_RIGHT_AND_ASSIGN(">>=", 0),
	BITWISE_AND_AND_ASSIGN("&=", 0),
	BITWISE_OR_AND_ASSIGN("|=", 0),
	XOR_AND_ASSIGN("^=", 0);

	/**
	 * Priority of the conditional expression <code>a if c else b</code>.
	 */
	public static final int TERNARY_PRIORITY = 2;

	private final String sequence;
	private final int priority;

	DualOperatorType(String sequence, int priority) {
		this.sequence = sequence;
		this.priority = priority;
	}

	public String getSequence() {
		return sequence;
	}

	public int getPriority() {
		return priority;
	}

	public boolean isAssignment() {
		return priority == 0;
	}

	public boolean isRightAssociative() {
		return isAssignment();
	}

	public static DualOperatorType bySequence(String sequence) {
		for (DualOperatorType type : values()) {
			if (type.sequence.equals(sequence)) {
				return type;
			}
		}
		return null;
	}
}
