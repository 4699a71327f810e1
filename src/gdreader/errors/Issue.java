package gdreader.errors;

import gdreader.GDReaderException;
import gdreader.Unreachable;
import gdreader.formatters.IndentingWriter;
import gdreader.formatters.IssueFormattingVisitor;
import gdreader.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem found in a parsed script. Issues are collected, not thrown, by the reader.
 */
public abstract class Issue extends GDReaderException {

	private final SourceLocation location;

	public Issue(SourceLocation location) {
		super("Issue", "");
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out, null));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;
}
