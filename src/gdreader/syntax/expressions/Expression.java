package gdreader.syntax.expressions;

import gdreader.syntax.Node;

public abstract class Expression extends Node {

	/**
	 * Priority of anything that is not an operator: literals, names, calls, brackets.
	 */
	public static final int PRIMARY_PRIORITY = 100;

	/**
	 * How tightly this expression binds its operands; higher binds tighter.
	 */
	public int getPriority() {
		return PRIMARY_PRIORITY;
	}
}
