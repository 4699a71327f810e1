package gdreader.syntax.tokens;

import gdreader.syntax.SimpleToken;

/**
 * Opening or closing quotes of a string literal: one or three quote characters.
 */
public final class StringBounder extends SimpleToken {

	private final char quote;
	private final boolean triple;

	public StringBounder(char quote, boolean triple) {
		this.quote = quote;
		this.triple = triple;
	}

	public char getQuote() {
		return quote;
	}

	public boolean isTriple() {
		return triple;
	}

	@Override
	public String getSequence() {
		String q = String.valueOf(quote);
		return triple ? q + q + q : q;
	}
}
