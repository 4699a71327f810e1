package gdreader.errors;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(InvalidTokenIssue invalidTokenIssue) throws E;
	public abstract T visit(UnterminatedStringIssue unterminatedStringIssue) throws E;
}
