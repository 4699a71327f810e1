package gdreader.syntax.expressions;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.DualOperatorType;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

/**
 * The conditional expression <code>a if condition else b</code>. The resolver builds it around an
 * already read <code>a</code> and the <code>if</code>; the node reads the rest itself.
 */
public final class IfExpression extends Expression {

	public enum State {
		TRUE_EXPRESSION,
		IF_KEYWORD,
		CONDITION,
		ELSE_KEYWORD,
		FALSE_EXPRESSION,
		COMPLETED
	}

	public static final Slot<State, Expression> TRUE_EXPRESSION = Slot.of(State.TRUE_EXPRESSION, Expression.class);
	public static final Slot<State, Keyword> IF_KEYWORD = Slot.of(State.IF_KEYWORD, Keyword.class);
	public static final Slot<State, Expression> CONDITION = Slot.of(State.CONDITION, Expression.class);
	public static final Slot<State, Keyword> ELSE_KEYWORD = Slot.of(State.ELSE_KEYWORD, Keyword.class);
	public static final Slot<State, Expression> FALSE_EXPRESSION = Slot.of(State.FALSE_EXPRESSION, Expression.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);
	private final boolean allowNewLines;

	public IfExpression(boolean allowNewLines) {
		this.allowNewLines = allowNewLines;
	}

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	@Override
	public int getPriority() {
		return DualOperatorType.TERNARY_PRIORITY;
	}

	public Expression getTrueExpression() {
		return form.get(TRUE_EXPRESSION);
	}

	public void setTrueExpression(Expression value) {
		form.set(TRUE_EXPRESSION, value);
	}

	public Expression getCondition() {
		return form.get(CONDITION);
	}

	public void setCondition(Expression value) {
		form.set(CONDITION, value);
	}

	public Keyword getElseKeyword() {
		return form.get(ELSE_KEYWORD);
	}

	public Expression getFalseExpression() {
		return form.get(FALSE_EXPRESSION);
	}

	public void setFalseExpression(Expression value) {
		form.set(FALSE_EXPRESSION, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (form.getState()) {
			case CONDITION:
				if (Chars.isSpace(c)) {
					readSpace(c, state);
					return;
				}
				if (Chars.isExpressionStart(c)) {
					state.push(new ExpressionResolver(form.receiver(CONDITION), allowNewLines, false));
					state.passChar(c);
					return;
				}
				form.skip(CONDITION);
				handleChar(c, state);
				return;
			case ELSE_KEYWORD:
				if (Chars.isSpace(c)) {
					readSpace(c, state);
					return;
				}
				if (c == 'e') {
					readKeyword(KeywordKind.ELSE, form.receiver(ELSE_KEYWORD), c, state);
					return;
				}
				form.complete();
				break;
			case FALSE_EXPRESSION:
				if (getElseKeyword() == null) {
					// no else, no false branch
					form.complete();
					break;
				}
				if (Chars.isSpace(c)) {
					readSpace(c, state);
					return;
				}
				if (Chars.isExpressionStart(c)) {
					state.push(new ExpressionResolver(form.receiver(FALSE_EXPRESSION), allowNewLines, false));
					state.passChar(c);
					return;
				}
				form.skip(FALSE_EXPRESSION);
				break;
			default:
				break;
		}
		state.popAndPass(c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		if (allowNewLines && !form.isCompleted()) {
			readNewLine();
		} else {
			form.complete();
			state.popAndPassNewLine();
		}
	}

	@Override
	public void forceComplete(ReadingState state) {
		form.complete();
		state.pop();
	}
}
