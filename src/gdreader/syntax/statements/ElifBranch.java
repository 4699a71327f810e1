package gdreader.syntax.statements;

import gdreader.syntax.tokens.KeywordKind;

public final class ElifBranch extends ConditionalBranch {

	public ElifBranch(int intendation) {
		super(KeywordKind.ELIF, true, intendation);
	}
}
