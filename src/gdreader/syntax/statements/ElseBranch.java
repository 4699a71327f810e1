package gdreader.syntax.statements;

import gdreader.syntax.tokens.KeywordKind;

public final class ElseBranch extends ConditionalBranch {

	public ElseBranch(int intendation) {
		super(KeywordKind.ELSE, false, intendation);
	}
}
