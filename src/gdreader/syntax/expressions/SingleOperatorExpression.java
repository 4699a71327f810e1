package gdreader.syntax.expressions;

import gdreader.InternalParserError;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.SingleOperator;

/**
 * A prefix operator applied to one operand, e.g. <code>-x</code> or <code>not done</code>.
 */
public final class SingleOperatorExpression extends Expression {

	public enum State {
		OPERATOR,
		TARGET,
		COMPLETED
	}

	public static final Slot<State, SingleOperator> OPERATOR = Slot.of(State.OPERATOR, SingleOperator.class);
	public static final Slot<State, Expression> TARGET = Slot.of(State.TARGET, Expression.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	public SingleOperatorExpression(SingleOperator operator) {
		form.receive(OPERATOR, operator);
	}

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public SingleOperator getOperator() {
		return form.get(OPERATOR);
	}

	public void setOperator(SingleOperator value) {
		form.set(OPERATOR, value);
	}

	public Expression getTarget() {
		return form.get(TARGET);
	}

	public void setTarget(Expression value) {
		form.set(TARGET, value);
	}

	@Override
	public int getPriority() {
		SingleOperator operator = getOperator();
		return operator == null ? PRIMARY_PRIORITY : operator.getOperatorType().getPriority();
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		throw new InternalParserError("single operator expressions are assembled by the expression resolver");
	}
}
