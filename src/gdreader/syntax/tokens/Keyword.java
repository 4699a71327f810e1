package gdreader.syntax.tokens;

import gdreader.syntax.SimpleToken;

public final class Keyword extends SimpleToken {

	private final KeywordKind kind;

	public Keyword(KeywordKind kind) {
		this.kind = kind;
	}

	public KeywordKind getKind() {
		return kind;
	}

	@Override
	public String getSequence() {
		return kind.getSequence();
	}
}
