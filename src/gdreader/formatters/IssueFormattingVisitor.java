package gdreader.formatters;

import gdreader.errors.InvalidTokenIssue;
import gdreader.errors.IssueVisitor;
import gdreader.errors.UnterminatedStringIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final CharSequence source;

	/**
	 * @param source the script text, or null to print positions only
	 */
	public IssueFormattingVisitor(IndentingWriter out, CharSequence source) {
		this.out = out;
		this.source = source;
	}

	@Override
	public Void visit(InvalidTokenIssue invalidTokenIssue) throws IOException {
		out.write("unexpected text \"");
		out.write(SyntaxTreeFormatter.escape(invalidTokenIssue.getToken().toString()));
		out.write("\" ");
		invalidTokenIssue.getLocation().writePretty(out, source);
		return null;
	}

	@Override
	public Void visit(UnterminatedStringIssue unterminatedStringIssue) throws IOException {
		out.write("unterminated string literal ");
		unterminatedStringIssue.getLocation().writePretty(out, source);
		return null;
	}
}
