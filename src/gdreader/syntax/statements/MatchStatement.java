package gdreader.syntax.statements;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.expressions.Expression;
import gdreader.syntax.expressions.ExpressionResolver;
import gdreader.syntax.lists.MatchCasesList;
import gdreader.syntax.tokens.Colon;
import gdreader.syntax.tokens.InvalidToken;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

/**
 * <code>match value:</code> followed by an indented block of cases.
 */
public final class MatchStatement extends Statement {

	public enum State {
		MATCH,
		VALUE,
		COLON,
		CASES,
		COMPLETED
	}

	public static final Slot<State, Keyword> MATCH = Slot.of(State.MATCH, Keyword.class);
	public static final Slot<State, Expression> VALUE = Slot.of(State.VALUE, Expression.class);
	public static final Slot<State, Colon> COLON = Slot.of(State.COLON, Colon.class);
	public static final Slot<State, MatchCasesList> CASES = Slot.of(State.CASES, MatchCasesList.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);
	private final int intendation;

	public MatchStatement(int intendation) {
		this.intendation = intendation;
	}

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Expression getValue() {
		return form.get(VALUE);
	}

	public void setValue(Expression value) {
		form.set(VALUE, value);
	}

	public MatchCasesList getCases() {
		return form.getOrCreate(CASES, () -> new MatchCasesList(intendation));
	}

	public void setCases(MatchCasesList value) {
		form.set(CASES, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (Chars.isSpace(c) && form.getState() != State.MATCH && !form.isCompleted()) {
			readSpace(c, state);
			return;
		}
		switch (form.getState()) {
			case MATCH:
				readKeyword(KeywordKind.MATCH, form.receiver(MATCH), c, state);
				return;
			case VALUE:
				if (Chars.isExpressionStart(c)) {
					state.push(new ExpressionResolver(form.receiver(VALUE)));
					state.passChar(c);
					return;
				}
				form.skip(VALUE);
				handleChar(c, state);
				return;
			case COLON:
				if (c == ':') {
					form.receive(COLON, new Colon());
					return;
				}
				form.skip(COLON);
				handleChar(c, state);
				return;
			case CASES:
				// cases start on the next line
				readInvalid(InvalidToken.untilLineEnd(), c, state);
				return;
			default:
				break;
		}
		state.popAndPass(c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		if (form.isCompleted()) {
			state.popAndPassNewLine();
			return;
		}
		form.setState(State.CASES);
		form.receive(CASES, state.push(new MatchCasesList(intendation)));
		state.passNewLine();
	}
}
