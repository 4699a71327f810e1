package gdreader.errors;

import gdreader.syntax.tokens.InvalidToken;

/**
 * Text the reader could not fit into the grammar.
 */
public class InvalidTokenIssue extends Issue {

	private final InvalidToken token;

	public InvalidTokenIssue(InvalidToken token) {
		super(token.getLocation());
		this.token = token;
	}

	public InvalidToken getToken() {
		return token;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
