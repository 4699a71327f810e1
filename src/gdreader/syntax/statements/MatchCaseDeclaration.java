package gdreader.syntax.statements;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Node;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.lists.ExpressionsList;
import gdreader.syntax.lists.StatementsList;
import gdreader.syntax.tokens.Colon;
import gdreader.syntax.tokens.InvalidToken;

/**
 * One case of a <code>match</code>: comma separated patterns, a colon and a body.
 */
public final class MatchCaseDeclaration extends Node {

	public enum State {
		CONDITIONS,
		COLON,
		STATEMENTS,
		COMPLETED
	}

	public static final Slot<State, ExpressionsList> CONDITIONS = Slot.of(State.CONDITIONS, ExpressionsList.class);
	public static final Slot<State, Colon> COLON = Slot.of(State.COLON, Colon.class);
	public static final Slot<State, StatementsList> STATEMENTS = Slot.of(State.STATEMENTS, StatementsList.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);
	private final int intendation;

	public MatchCaseDeclaration(int intendation) {
		this.intendation = intendation;
	}

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public ExpressionsList getConditions() {
		return form.getOrCreate(CONDITIONS, () -> new ExpressionsList(false));
	}

	public void setConditions(ExpressionsList value) {
		form.set(CONDITIONS, value);
	}

	public StatementsList getStatements() {
		return form.getOrCreate(STATEMENTS, () -> new StatementsList(intendation));
	}

	public void setStatements(StatementsList value) {
		form.set(STATEMENTS, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (Chars.isSpace(c) && form.getState() != State.CONDITIONS && !form.isCompleted()) {
			readSpace(c, state);
			return;
		}
		switch (form.getState()) {
			case CONDITIONS:
				readInto(form, CONDITIONS, new ExpressionsList(false), c, state);
				return;
			case COLON:
				if (c == ':') {
					form.receive(COLON, new Colon());
					return;
				}
				form.skip(COLON);
				handleChar(c, state);
				return;
			case STATEMENTS:
				if (form.get(COLON) == null) {
					readInvalid(InvalidToken.untilLineEnd(), c, state);
					return;
				}
				readInto(form, STATEMENTS, new StatementsList(intendation), c, state);
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
		form.setState(State.STATEMENTS);
		form.receive(STATEMENTS, state.push(new StatementsList(intendation)));
		state.passNewLine();
	}
}
