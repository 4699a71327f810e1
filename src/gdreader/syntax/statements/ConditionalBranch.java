package gdreader.syntax.statements;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Node;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.expressions.Expression;
import gdreader.syntax.expressions.ExpressionResolver;
import gdreader.syntax.lists.StatementsList;
import gdreader.syntax.tokens.Colon;
import gdreader.syntax.tokens.InvalidToken;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

/**
 * One branch of an <code>if</code>: keyword, condition (absent for <code>else</code>), colon and body.
 */
public abstract class ConditionalBranch extends Node {

	public enum State {
		KEYWORD,
		CONDITION,
		COLON,
		STATEMENTS,
		COMPLETED
	}

	public static final Slot<State, Keyword> KEYWORD = Slot.of(State.KEYWORD, Keyword.class);
	public static final Slot<State, Expression> CONDITION = Slot.of(State.CONDITION, Expression.class);
	public static final Slot<State, Colon> COLON = Slot.of(State.COLON, Colon.class);
	public static final Slot<State, StatementsList> STATEMENTS = Slot.of(State.STATEMENTS, StatementsList.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);
	private final KeywordKind keyword;
	private final boolean withCondition;
	private final int intendation;

	protected ConditionalBranch(KeywordKind keyword, boolean withCondition, int intendation) {
		this.keyword = keyword;
		this.withCondition = withCondition;
		this.intendation = intendation;
	}

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Keyword getKeyword() {
		return form.get(KEYWORD);
	}

	public Expression getCondition() {
		return form.get(CONDITION);
	}

	public void setCondition(Expression value) {
		form.set(CONDITION, value);
	}

	public StatementsList getStatements() {
		return form.getOrCreate(STATEMENTS, () -> new StatementsList(intendation));
	}

	public void setStatements(StatementsList value) {
		form.set(STATEMENTS, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (Chars.isSpace(c) && form.getState() != State.KEYWORD && !form.isCompleted()) {
			readSpace(c, state);
			return;
		}
		switch (form.getState()) {
			case KEYWORD:
				readKeyword(keyword, form.receiver(KEYWORD), c, state);
				return;
			case CONDITION:
				if (withCondition && Chars.isExpressionStart(c)) {
					state.push(new ExpressionResolver(form.receiver(CONDITION)));
					state.passChar(c);
					return;
				}
				form.skip(CONDITION);
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
