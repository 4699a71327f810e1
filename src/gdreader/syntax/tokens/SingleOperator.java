package gdreader.syntax.tokens;

import gdreader.syntax.SimpleToken;

public final class SingleOperator extends SimpleToken {

	private final SingleOperatorType type;

	public SingleOperator(SingleOperatorType type) {
		this.type = type;
	}

	public SingleOperatorType getOperatorType() {
		return type;
	}

	@Override
	public String getSequence() {
		return type.getSequence();
	}
}
