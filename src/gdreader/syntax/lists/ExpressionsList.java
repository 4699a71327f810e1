package gdreader.syntax.lists;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.expressions.Expression;
import gdreader.syntax.expressions.ExpressionResolver;

/**
 * Comma separated expressions: call arguments, array values, match patterns. Ends at the first
 * character that can neither start an expression nor separate one.
 */
public final class ExpressionsList extends SeparatedTokensList<Expression> {

	public ExpressionsList(boolean allowNewLines) {
		super(allowNewLines);
	}

	@Override
	protected boolean isItemStart(char c) {
		return Chars.isExpressionStart(c);
	}

	@Override
	protected void startItem(char c, ReadingState state) {
		state.push(new ExpressionResolver(getForm().itemReceiver(), isAllowNewLines()));
		state.passChar(c);
	}
}
