package gdreader.syntax.lists;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.statements.MatchCaseDeclaration;

/**
 * The indented cases of a <code>match</code>.
 */
public final class MatchCasesList extends IntendedTokensList<MatchCaseDeclaration> {

	public MatchCasesList(int parentColumn) {
		super(parentColumn);
	}

	@Override
	protected void startItem(char c, ReadingState state) {
		if (Chars.isExpressionStart(c)) {
			pushItem(new MatchCaseDeclaration(getLineColumn()), c, state);
		} else {
			readInvalidLine(c, state);
		}
	}

	@Override
	protected void startItemWithWord(String word, ReadingState state) {
		pushItem(new MatchCaseDeclaration(getLineColumn()), word, state);
	}
}
