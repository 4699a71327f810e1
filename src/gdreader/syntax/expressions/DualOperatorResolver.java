package gdreader.syntax.expressions;

import gdreader.reader.ReadingState;
import gdreader.reader.SequenceResolver;
import gdreader.reader.SequenceTable;
import gdreader.syntax.tokens.DualOperatorType;
import gdreader.syntax.tokens.KeywordKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the operator that follows an operand: any binary operator, or the <code>if</code> of a
 * conditional expression. The longest operator wins, so <code>**=</code> is never read as
 * <code>**</code> followed by <code>=</code>.
 */
final class DualOperatorResolver extends SequenceResolver {

	static final SequenceTable TABLE;

	static {
		List<String> sequences = new ArrayList<>();
		for (DualOperatorType type : DualOperatorType.values()) {
			sequences.add(type.getSequence());
		}
		sequences.add(KeywordKind.IF.getSequence());
		TABLE = SequenceTable.of(sequences);
	}

	private final ExpressionResolver owner;

	DualOperatorResolver(ExpressionResolver owner) {
		this.owner = owner;
	}

	static boolean canStart(char c) {
		return TABLE.canStart(c);
	}

	@Override
	protected SequenceTable getTable() {
		return TABLE;
	}

	@Override
	protected boolean onMatch(String sequence, ReadingState state) {
		if (sequence.equals(KeywordKind.IF.getSequence())) {
			return owner.insertConditional(state);
		}
		return owner.insertOperator(DualOperatorType.bySequence(sequence), state);
	}

	@Override
	protected void onNoMatch(ReadingState state) {
		owner.stopAtOperator();
	}
}
