package gdreader.errors;

import gdreader.formatters.IndentingWriter;
import gdreader.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> errors = new ArrayList<>();
	private final CharSequence source;

	public TopLevelIssueContext() {
		this(null);
	}

	/**
	 * @param source the script text, used to quote the offending lines; may be null
	 */
	public TopLevelIssueContext(CharSequence source) {
		this.source = source;
	}

	@Override
	public void error(Issue err) {
		errors.add(err);
	}

	@Override
	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	public List<Issue> getIssues() {
		return errors;
	}

	public void format(IndentingWriter out) throws IOException {
		out.write("Detected ");
		out.write(Integer.toString(errors.size()));
		out.write(" issue(s):");
		for (Issue e : errors) {
			out.newLine();
			e.accept(new IssueFormattingVisitor(out, source));
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			format(out);
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}
}
