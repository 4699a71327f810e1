package gdreader.syntax.expressions;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.InvalidToken;
import gdreader.syntax.tokens.StringBounder;
import gdreader.syntax.tokens.StringPart;
import gdreader.syntax.tokens.StringPrefix;

/**
 * A string literal in single, double or triple quotes. Escapes are kept as written. A literal
 * cut short by the end of the line (single quotes) or of the input keeps its opening quote, and
 * its body becomes an invalid token.
 *
 * A leading '&amp;' makes a string name, a leading '^' a node path. A prefix with no literal after it
 * leaves the string without quotes, and so unterminated.
 */
public final class StringExpression extends Expression {

	public enum State {
		PREFIX,
		OPEN_QUOTE,
		PART,
		CLOSE_QUOTE,
		COMPLETED
	}

	public static final Slot<State, StringPrefix> PREFIX = Slot.of(State.PREFIX, StringPrefix.class);
	public static final Slot<State, StringBounder> OPEN_QUOTE = Slot.of(State.OPEN_QUOTE, StringBounder.class);
	public static final Slot<State, StringPart> PART = Slot.of(State.PART, StringPart.class);
	public static final Slot<State, StringBounder> CLOSE_QUOTE = Slot.of(State.CLOSE_QUOTE, StringBounder.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);
	private char quote;
	private int openQuotes;
	private int closeQuotes;
	private boolean escaped;

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public StringPrefix getPrefix() {
		return form.get(PREFIX);
	}

	public boolean isStringName() {
		StringPrefix prefix = getPrefix();
		return prefix != null && prefix.getChar() == '&';
	}

	public boolean isNodePath() {
		StringPrefix prefix = getPrefix();
		return prefix != null && prefix.getChar() == '^';
	}

	public StringBounder getOpenQuote() {
		return form.get(OPEN_QUOTE);
	}

	public StringBounder getCloseQuote() {
		return form.get(CLOSE_QUOTE);
	}

	public boolean isTriple() {
		StringBounder open = getOpenQuote();
		return open != null && open.isTriple();
	}

	/**
	 * The body between the quotes as written, escapes included.
	 */
	public String getRawValue() {
		StringPart part = form.get(PART);
		return part == null ? "" : part.getSequence();
	}

	public boolean isTerminated() {
		return getCloseQuote() != null;
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (form.getState()) {
			case PREFIX:
				if (StringPrefix.isPrefix(c)) {
					form.receive(PREFIX, new StringPrefix(c));
					return;
				}
				form.skip(PREFIX);
				handleChar(c, state);
				return;
			case OPEN_QUOTE:
				if (openQuotes == 0 && !Chars.isQuote(c)) {
					form.complete();
					state.popAndPass(c);
					return;
				}
				readOpening(c, state);
				return;
			case PART:
			case CLOSE_QUOTE:
				readBody(c);
				return;
			default:
				state.popAndPass(c);
				return;
		}
	}

	private void readOpening(char c, ReadingState state) {
		if (openQuotes == 0) {
			quote = c;
			openQuotes = 1;
			return;
		}
		if (c == quote && openQuotes < 3) {
			openQuotes++;
			return;
		}
		endOpening();
		handleChar(c, state);
	}

	private void endOpening() {
		if (openQuotes == 2) {
			// two quotes are an empty string, not the start of a triple quoted one
			form.receive(OPEN_QUOTE, new StringBounder(quote, false));
			form.skip(PART);
			form.receive(CLOSE_QUOTE, new StringBounder(quote, false));
		} else {
			form.receive(OPEN_QUOTE, new StringBounder(quote, openQuotes == 3));
		}
	}

	private void readBody(char c) {
		if (escaped) {
			escaped = false;
			append(c);
			return;
		}
		if (c == quote) {
			if (!isTriple()) {
				close();
				return;
			}
			closeQuotes++;
			if (closeQuotes == 3) {
				close();
			}
			return;
		}
		flushCloseQuotes();
		append(c);
		if (c == '\\') {
			escaped = true;
		}
	}

	private void flushCloseQuotes() {
		for (; closeQuotes > 0; closeQuotes--) {
			append(quote);
		}
	}

	private void append(char c) {
		StringPart part = form.get(PART);
		if (part == null) {
			part = new StringPart();
			form.receive(PART, part);
		}
		part.appendChar(c);
	}

	private void close() {
		if (form.getState() == State.PART) {
			form.skip(PART);
		}
		form.receive(CLOSE_QUOTE, new StringBounder(quote, isTriple()));
	}

	private void terminate() {
		flushCloseQuotes();
		StringPart part = form.get(PART);
		if (part != null) {
			form.remove(part);
			form.addBefore(State.CLOSE_QUOTE, new InvalidToken(part.getSequence()));
		}
		form.complete();
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		switch (form.getState()) {
			case PREFIX:
				form.complete();
				break;
			case OPEN_QUOTE:
				if (openQuotes == 0) {
					form.complete();
					break;
				}
				endOpening();
				handleNewLineChar(state);
				return;
			case PART:
			case CLOSE_QUOTE:
				if (isTriple() || escaped) {
					readBody('\n');
					return;
				}
				terminate();
				break;
			default:
				break;
		}
		state.popAndPassNewLine();
	}

	@Override
	public void handleSharpChar(ReadingState state) {
		handleChar('#', state);
	}

	@Override
	public void handleCarriageReturnChar(ReadingState state) {
		handleChar('\r', state);
	}

	@Override
	public void handleLeftSlashChar(ReadingState state) {
		handleChar('\\', state);
	}

	@Override
	public void handleContinuedNewLine(ReadingState state) {
		handleNewLineChar(state);
	}

	@Override
	public void forceComplete(ReadingState state) {
		if (form.isOrLowerState(State.OPEN_QUOTE) && openQuotes == 0) {
			form.complete();
		} else if (form.getState() == State.OPEN_QUOTE) {
			endOpening();
		}
		if (!form.isCompleted()) {
			terminate();
		}
		state.pop();
	}
}
