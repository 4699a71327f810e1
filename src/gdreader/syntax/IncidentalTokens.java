package gdreader.syntax;

import gdreader.syntax.tokens.CarriageReturn;
import gdreader.syntax.tokens.Intendation;
import gdreader.syntax.tokens.NewLine;
import gdreader.syntax.tokens.Space;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns buffered whitespace back into tokens.
 */
public final class IncidentalTokens {

	private IncidentalTokens() {
	}

	/**
	 * Splits a run of line breaks, carriage returns, spaces and tabs into tokens. Blanks that follow a
	 * line break become {@link Intendation}, other blanks {@link Space}.
	 */
	public static List<SyntaxToken> fromWhitespace(CharSequence whitespace) {
		List<SyntaxToken> tokens = new ArrayList<>();
		StringBuilder blanks = new StringBuilder();
		boolean lineStart = false;
		for (int i = 0; i < whitespace.length(); i++) {
			char c = whitespace.charAt(i);
			if (c == ' ' || c == '\t') {
				blanks.append(c);
				continue;
			}
			flushBlanks(tokens, blanks, lineStart);
			if (c == '\n') {
				tokens.add(new NewLine());
				lineStart = true;
			} else if (c == '\r') {
				tokens.add(new CarriageReturn());
			} else {
				throw new IllegalArgumentException("not whitespace: '" + c + "'");
			}
		}
		flushBlanks(tokens, blanks, lineStart);
		return tokens;
	}

	private static void flushBlanks(List<SyntaxToken> tokens, StringBuilder blanks, boolean lineStart) {
		if (blanks.length() == 0) {
			return;
		}
		tokens.add(lineStart ? new Intendation(blanks.toString()) : new Space(blanks.toString()));
		blanks.setLength(0);
	}

	public static void addBeforeActive(AbstractTokensForm form, CharSequence whitespace) {
		for (SyntaxToken t : fromWhitespace(whitespace)) {
			form.addBeforeActive(t);
		}
	}
}
