package gdreader.syntax.tokens;

import gdreader.syntax.SimpleToken;

public final class DualOperator extends SimpleToken {

	private final DualOperatorType type;

	public DualOperator(DualOperatorType type) {
		this.type = type;
	}

	public DualOperatorType getOperatorType() {
		return type;
	}

	@Override
	public String getSequence() {
		return type.getSequence();
	}
}
