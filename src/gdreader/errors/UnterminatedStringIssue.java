package gdreader.errors;

import gdreader.syntax.expressions.StringExpression;

public class UnterminatedStringIssue extends Issue {

	private final StringExpression string;

	public UnterminatedStringIssue(StringExpression string) {
		super(string.getLocation());
		this.string = string;
	}

	public StringExpression getString() {
		return string;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
