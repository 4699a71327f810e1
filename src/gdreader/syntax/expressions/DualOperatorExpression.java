package gdreader.syntax.expressions;

import gdreader.InternalParserError;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.DualOperator;
import gdreader.syntax.tokens.DualOperatorType;

/**
 * A binary operation. Operands are arranged so that the tree respects operator priorities:
 * <code>a + b * c</code> has the multiplication as its right operand.
 */
public final class DualOperatorExpression extends Expression {

	public enum State {
		LEFT,
		OPERATOR,
		RIGHT,
		COMPLETED
	}

	public static final Slot<State, Expression> LEFT = Slot.of(State.LEFT, Expression.class);
	public static final Slot<State, DualOperator> OPERATOR = Slot.of(State.OPERATOR, DualOperator.class);
	public static final Slot<State, Expression> RIGHT = Slot.of(State.RIGHT, Expression.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Expression getLeft() {
		return form.get(LEFT);
	}

	public void setLeft(Expression value) {
		form.set(LEFT, value);
	}

	public DualOperator getOperator() {
		return form.get(OPERATOR);
	}

	public void setOperator(DualOperator value) {
		form.set(OPERATOR, value);
	}

	public DualOperatorType getOperatorType() {
		DualOperator operator = getOperator();
		return operator == null ? null : operator.getOperatorType();
	}

	public Expression getRight() {
		return form.get(RIGHT);
	}

	public void setRight(Expression value) {
		form.set(RIGHT, value);
	}

	@Override
	public int getPriority() {
		DualOperatorType type = getOperatorType();
		return type == null ? PRIMARY_PRIORITY : type.getPriority();
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		throw new InternalParserError("dual operator expressions are assembled by the expression resolver");
	}
}
