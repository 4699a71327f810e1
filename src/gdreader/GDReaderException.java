package gdreader;

/**
 * A reader exception consisting of a prefix (type of error) and, where known, a line number
 * in the offending file
 *
 */
public abstract class GDReaderException extends RuntimeException {
	private final int line;
	private final String msg;
	private final String prefix;

	public GDReaderException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
		this.line = -1;
	}

	public GDReaderException(String prefix, String msg, Throwable cause) {
		super(prefix + ": " + msg, cause);
		this.prefix = prefix;
		this.msg = msg;
		this.line = -1;
	}

	public GDReaderException(String prefix, String msg, int lineN) {
		super(prefix + ": " + msg + " at Line: " + lineN);
		this.prefix = prefix;
		this.line = lineN;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}

	public int getLine() {
		return line;
	}
}
