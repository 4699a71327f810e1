package gdreader.formatters;

import gdreader.Unreachable;
import gdreader.syntax.Node;
import gdreader.syntax.SyntaxToken;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Prints a tree one element per line, children indented under their node. Leaves are followed by
 * their escaped text.
 */
public final class SyntaxTreeFormatter {

	private SyntaxTreeFormatter() {
	}

	public static String format(SyntaxToken token) {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw, 2);
		try {
			write(out, token);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return sw.toString();
	}

	public static void write(IndentingWriter out, SyntaxToken token) throws IOException {
		out.write(token.getClass().getSimpleName());
		if (!(token instanceof Node)) {
			out.write(" \"");
			out.write(escape(token.toOriginalString()));
			out.write("\"");
			return;
		}
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (SyntaxToken child : ((Node) token).getForm()) {
				out.newLine();
				write(out, child);
			}
		}
	}

	public static String escape(String text) {
		StringBuilder builder = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
				case '\n':
					builder.append("\\n");
					break;
				case '\r':
					builder.append("\\r");
					break;
				case '\t':
					builder.append("\\t");
					break;
				case '"':
				case '\\':
					builder.append('\\').append(c);
					break;
				default:
					builder.append(c);
					break;
			}
		}
		return builder.toString();
	}
}
