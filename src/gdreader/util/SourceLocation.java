package gdreader.util;

import gdreader.Unreachable;
import gdreader.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A span of script text. Offsets, lines and columns are 0-based; the end is exclusive.
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public String prettyString(CharSequence source) {
		StringWriter sw = new StringWriter();
		writePretty(new IndentingWriter(sw), source);
		return sw.getBuffer().toString();
	}

	/**
	 * Writes the position followed by the affected source line(s), with carets under the span.
	 */
	public void writePretty(IndentingWriter out, CharSequence source) {
		try {
			if (isUnknown()) {
				out.write("at unknown source location");
				return;
			}
			out.write("at ");
			if (startLine != endLine) {
				out.write("" + (startLine + 1) + ":" + (startColumn + 1) + "-" + (endLine + 1) + ":" + endColumn);
			} else if (startColumn != endColumn) {
				out.write("" + (startLine + 1) + ":" + (startColumn + 1) + "-" + endColumn);
			} else {
				out.write("" + (startLine + 1) + ":" + (startColumn + 1));
			}
			if (source == null) {
				return;
			}
			out.newLine();
			int lineStart = Math.min(startOffset, source.length());
			while (lineStart > 0 && source.charAt(lineStart - 1) != '\n') {
				lineStart--;
			}
			int lineEnd = startOffset;
			while (lineEnd < source.length() && source.charAt(lineEnd) != '\n' && source.charAt(lineEnd) != '\r') {
				lineEnd++;
			}
			out.append(source, lineStart, lineEnd);
			out.newLine();
			for (int pos = lineStart; pos < startOffset; pos++) {
				out.append(source.charAt(pos) == '\t' ? '\t' : ' ');
			}
			int effectiveEndOffset = startOffset == endOffset ? endOffset + 1 : endOffset;
			for (int pos = startOffset; pos < lineEnd && pos < effectiveEndOffset; pos++) {
				out.append('^');
			}
			if (startOffset == source.length()) {
				out.append("^ EOF");
			}
		} catch (IOException e) {
			throw new Unreachable(e); // string ops shouldn't throw IO exceptions
		}
	}

	public static SourceLocation unknown() {
		return new SourceLocation(-1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return startOffset < 0;
	}

	/**
	 * True if (line, column) lies inside this span. The start is inclusive, the end exclusive.
	 */
	public boolean contains(int line, int column) {
		if (isUnknown()) {
			return false;
		}
		if (line < startLine || line > endLine) {
			return false;
		}
		if (line == startLine && column < startColumn) {
			return false;
		}
		return line != endLine || column < endColumn;
	}

	/**
	 * True if this span lies entirely within the given rectangle.
	 */
	public boolean isInside(int fromLine, int fromColumn, int toLine, int toColumn) {
		if (isUnknown()) {
			return false;
		}
		return compare(fromLine, fromColumn, startLine, startColumn) <= 0
				&& compare(endLine, endColumn, toLine, toColumn) <= 0;
	}

	public boolean overlaps(int fromLine, int fromColumn, int toLine, int toColumn) {
		if (isUnknown()) {
			return false;
		}
		return compare(startLine, startColumn, toLine, toColumn) < 0
				&& compare(fromLine, fromColumn, endLine, endColumn) < 0;
	}

	private static int compare(int lineA, int columnA, int lineB, int columnB) {
		int comparedLine = Integer.compare(lineA, lineB);
		if (comparedLine != 0) {
			return comparedLine;
		}
		return Integer.compare(columnA, columnB);
	}

	public SourceLocation combine(SourceLocation other) {
		if (isUnknown()) {
			return other;
		} else if (other.isUnknown()) {
			return this;
		}
		SourceLocation first = compare(startLine, startColumn, other.startLine, other.startColumn) <= 0 ? this : other;
		SourceLocation last = compare(endLine, endColumn, other.endLine, other.endColumn) >= 0 ? this : other;
		return new SourceLocation(
				first.startOffset,
				last.endOffset,
				first.startLine,
				last.endLine,
				first.startColumn,
				last.endColumn);
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + endColumn;
		result = prime * result + endLine;
		result = prime * result + startOffset;
		result = prime * result + endOffset;
		result = prime * result + startColumn;
		result = prime * result + startLine;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return endColumn == other.endColumn && endLine == other.endLine && startColumn == other.startColumn &&
				startOffset == other.startOffset && endOffset == other.endOffset && startLine == other.startLine;
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		} else {
			return "SourceLocation [startOffset=" + startOffset + ", endOffset=" + endOffset +
					", startLine=" + startLine + ", endLine=" + endLine + ", startColumn=" + startColumn +
					", endColumn=" + endColumn + "]";
		}
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedStart = compare(startLine, startColumn, o.startLine, o.startColumn);
		if (comparedStart != 0) {
			return comparedStart;
		}
		int comparedStartOffset = Integer.compare(getStartOffset(), o.getStartOffset());
		if (comparedStartOffset != 0) {
			return comparedStartOffset;
		}
		return Integer.compare(getEndOffset(), o.getEndOffset());
	}

}
