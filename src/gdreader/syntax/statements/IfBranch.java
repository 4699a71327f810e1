package gdreader.syntax.statements;

import gdreader.syntax.tokens.KeywordKind;

public final class IfBranch extends ConditionalBranch {

	public IfBranch(int intendation) {
		super(KeywordKind.IF, true, intendation);
	}
}
