package gdreader.syntax.expressions;

import gdreader.reader.CharReader;
import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.reader.WordResolver;
import gdreader.syntax.Node;
import gdreader.syntax.SyntaxToken;
import gdreader.syntax.TokenReceiver;
import gdreader.syntax.tokens.CarriageReturn;
import gdreader.syntax.tokens.Comment;
import gdreader.syntax.tokens.DualOperator;
import gdreader.syntax.tokens.DualOperatorType;
import gdreader.syntax.tokens.Identifier;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;
import gdreader.syntax.tokens.LeftSlash;
import gdreader.syntax.tokens.NewLine;
import gdreader.syntax.tokens.SingleOperator;
import gdreader.syntax.tokens.SingleOperatorType;
import gdreader.syntax.tokens.Space;
import gdreader.syntax.tokens.StringPrefix;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles one expression out of operands and operators, arranging operators by priority.
 *
 * Operands are pushed on the reading stack and read themselves; the resolver stays below them and
 * decides what follows each one: a postfix part (call, member access, indexer), an operator, or
 * the end of the expression. Whitespace after an operand is held back until that decision is made.
 * It goes into the next operator or postfix node, or back to the owner when the expression ends.
 *
 * The finished tree is delivered to the receiver when the resolver leaves the stack, or the
 * receiver is told that no expression was found.
 */
public final class ExpressionResolver extends CharReader {

	private enum Mode {
		START,
		OPERAND,
		FINISHING
	}

	private final TokenReceiver<Expression> receiver;
	private final boolean allowNewLines;
	private final boolean allowAssignment;
	private final List<SyntaxToken> pending = new ArrayList<>();

	private Mode mode = Mode.START;
	private Expression root;
	private Expression lastOperand;
	// where the next operand goes, and the node that owns that place
	private TokenReceiver<Expression> hole = new RootHole();
	private Node holeOwner;

	public ExpressionResolver(TokenReceiver<Expression> receiver) {
		this(receiver, false, true);
	}

	/**
	 * @param allowNewLines whether line breaks and comments may appear between the parts of the
	 * expression, as they may inside brackets
	 */
	public ExpressionResolver(TokenReceiver<Expression> receiver, boolean allowNewLines) {
		this(receiver, allowNewLines, true);
	}

	/**
	 * @param allowAssignment false if an assignment operator must end the expression instead, as in
	 * a dictionary key written <code>key = value</code>
	 */
	public ExpressionResolver(TokenReceiver<Expression> receiver, boolean allowNewLines, boolean allowAssignment) {
		this.receiver = receiver;
		this.allowNewLines = allowNewLines;
		this.allowAssignment = allowAssignment;
	}

	private boolean isStarted() {
		return root != null;
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (mode) {
			case START:
				handleOperandStart(c, state);
				break;
			case OPERAND:
				handleAfterOperand(c, state);
				break;
			default:
				finish(state);
				state.passChar(c);
				break;
		}
	}

	private void handleOperandStart(char c, ReadingState state) {
		if (Chars.isSpace(c) && isStarted()) {
			readPendingSpace(c, state);
			return;
		}
		if (Chars.isIdentifierStart(c)) {
			state.push(new WordResolver(this::handleWord));
			state.passChar(c);
			return;
		}
		if (Chars.isDigit(c)) {
			pushOperand(new NumberExpression(), c, state);
			return;
		}
		if (Chars.isQuote(c) || StringPrefix.isPrefix(c)) {
			pushOperand(new StringExpression(), c, state);
			return;
		}
		switch (c) {
			case '$':
			case '%':
				pushOperand(new GetNodeExpression(), c, state);
				return;
			case '(':
				pushOperand(new BracketExpression(), c, state);
				return;
			case '[':
				pushOperand(new ArrayInitializerExpression(), c, state);
				return;
			case '{':
				pushOperand(new DictionaryInitializerExpression(), c, state);
				return;
			default:
				break;
		}
		SingleOperatorType prefix = SingleOperatorType.byChar(c);
		if (prefix != null) {
			placePrefix(new SingleOperatorExpression(new SingleOperator(prefix)));
			return;
		}
		finish(state);
		state.passChar(c);
	}

	private void handleAfterOperand(char c, ReadingState state) {
		if (Chars.isSpace(c)) {
			readPendingSpace(c, state);
			return;
		}
		Node parent = lastOperand.getParent();
		switch (c) {
			case '(':
				pushPostfix(parent, new CallExpression(lastOperand), c, state);
				return;
			case '[':
				pushPostfix(parent, new IndexerExpression(lastOperand), c, state);
				return;
			case '.':
				pushPostfix(parent, new MemberOperatorExpression(lastOperand), c, state);
				return;
			default:
				break;
		}
		if (DualOperatorResolver.canStart(c)) {
			state.push(new DualOperatorResolver(this));
			state.passChar(c);
			return;
		}
		finish(state);
		state.passChar(c);
	}

	private void handleWord(String word, ReadingState state) {
		SingleOperatorType prefix = SingleOperatorType.byWord(word);
		if (prefix != null) {
			placePrefix(new SingleOperatorExpression(new SingleOperator(prefix)));
			return;
		}
		KeywordKind kind = KeywordKind.bySequence(word);
		if (kind == null) {
			placeOperand(new IdentifierExpression(new Identifier(word)));
			return;
		}
		switch (kind) {
			case TRUE:
				placeOperand(new BoolExpression(true));
				break;
			case FALSE:
				placeOperand(new BoolExpression(false));
				break;
			case NULL:
			case SELF:
			case PASS:
			case BREAK:
			case CONTINUE:
			case BREAKPOINT:
				placeOperand(new KeywordExpression(kind));
				break;
			case RETURN:
				placeOperand(state.push(new ReturnExpression()));
				break;
			case FUNC:
				placeOperand(state.push(new LambdaExpression(state.getLineColumn())));
				break;
			case VAR:
				placeOperand(state.push(new BindingPatternExpression()));
				break;
			default:
				// other keywords are plain names in an expression
				placeOperand(new IdentifierExpression(new Identifier(word)));
				break;
		}
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		if (mode != Mode.FINISHING && allowNewLines && isStarted()) {
			pending.add(new NewLine());
			return;
		}
		finish(state);
		state.passNewLine();
	}

	@Override
	public void handleContinuedNewLine(ReadingState state) {
		if (mode != Mode.FINISHING && isStarted()) {
			pending.add(new NewLine());
			return;
		}
		finish(state);
		state.markLineContinuation();
		state.passNewLine();
	}

	@Override
	public void handleSharpChar(ReadingState state) {
		if (mode != Mode.FINISHING && allowNewLines && isStarted()) {
			Comment comment = new Comment();
			pending.add(comment);
			state.push(comment);
			state.passChar('#');
			return;
		}
		finish(state);
		state.passChar('#');
	}

	@Override
	public void handleCarriageReturnChar(ReadingState state) {
		if (mode != Mode.FINISHING && isStarted()) {
			pending.add(new CarriageReturn());
			return;
		}
		finish(state);
		state.passCarriageReturn();
	}

	@Override
	public void handleLeftSlashChar(ReadingState state) {
		if (mode != Mode.FINISHING && isStarted()) {
			pending.add(new LeftSlash());
			state.markLineContinuation();
			return;
		}
		finish(state);
		state.passChar('\\');
	}

	@Override
	public void forceComplete(ReadingState state) {
		finish(state);
	}

	private void readPendingSpace(char c, ReadingState state) {
		Space space = new Space();
		pending.add(space);
		state.push(space);
		state.passChar(c);
	}

	private void pushOperand(Expression operand, char c, ReadingState state) {
		placeOperand(operand);
		state.push(operand);
		state.passChar(c);
	}

	private void placeOperand(Expression operand) {
		flushPending(holeOwner);
		hole.handleReceivedToken(operand);
		hole = null;
		holeOwner = null;
		lastOperand = operand;
		mode = Mode.OPERAND;
	}

	private void placePrefix(SingleOperatorExpression prefix) {
		flushPending(holeOwner);
		hole.handleReceivedToken(prefix);
		hole = prefix.getForm().receiver(SingleOperatorExpression.TARGET);
		holeOwner = prefix;
		mode = Mode.START;
	}

	/**
	 * The postfix node has already taken the last operand, a child of <code>parent</code>, as its first child.
	 */
	private void pushPostfix(Node parent, Expression postfix, char c, ReadingState state) {
		replaceChild(parent, postfix);
		flushPending(postfix);
		lastOperand = postfix;
		state.push(postfix);
		state.passChar(c);
	}

	boolean insertOperator(DualOperatorType type, ReadingState state) {
		if (type.isAssignment() && !allowAssignment) {
			mode = Mode.FINISHING;
			return false;
		}
		Expression target = findInsertionTarget(type.getPriority(), type.isRightAssociative());
		Node parent = target.getParent();
		DualOperatorExpression operation = new DualOperatorExpression();
		operation.getForm().receive(DualOperatorExpression.LEFT, target);
		replaceChild(parent, operation);
		flushPending(operation);
		operation.getForm().receive(DualOperatorExpression.OPERATOR, new DualOperator(type));
		hole = operation.getForm().receiver(DualOperatorExpression.RIGHT);
		holeOwner = operation;
		mode = Mode.START;
		return true;
	}

	boolean insertConditional(ReadingState state) {
		Expression target = findInsertionTarget(DualOperatorType.TERNARY_PRIORITY, true);
		Node parent = target.getParent();
		IfExpression conditional = new IfExpression(allowNewLines);
		conditional.getForm().receive(IfExpression.TRUE_EXPRESSION, target);
		replaceChild(parent, conditional);
		flushPending(conditional);
		conditional.getForm().receive(IfExpression.IF_KEYWORD, new Keyword(KeywordKind.IF));
		lastOperand = conditional;
		mode = Mode.OPERAND;
		state.push(conditional);
		return true;
	}

	void stopAtOperator() {
		mode = Mode.FINISHING;
	}

	/**
	 * Walks down the right edge of the tree to the operand a new operator of the given priority
	 * takes as its left side. The walk goes all the way down: a prefix operator below a tighter
	 * operator still takes everything of higher priority that follows it.
	 */
	private Expression findInsertionTarget(int priority, boolean rightAssociative) {
		Expression target = root;
		Expression node = root;
		while (true) {
			Expression right = rightOperand(node);
			if (right == null) {
				return target;
			}
			int p = node.getPriority();
			if (p < priority || (p == priority && rightAssociative)) {
				target = right;
			}
			node = right;
		}
	}

	private static Expression rightOperand(Expression node) {
		if (node instanceof DualOperatorExpression) {
			return ((DualOperatorExpression) node).getRight();
		}
		if (node instanceof SingleOperatorExpression) {
			return ((SingleOperatorExpression) node).getTarget();
		}
		return null;
	}

	/**
	 * Puts a new node where its first child used to be. The child has already moved into it.
	 */
	private void replaceChild(Node parent, Expression replacement) {
		if (parent instanceof DualOperatorExpression) {
			((DualOperatorExpression) parent).setRight(replacement);
		} else if (parent instanceof SingleOperatorExpression) {
			((SingleOperatorExpression) parent).setTarget(replacement);
		} else {
			root = replacement;
		}
	}

	private void flushPending(Node owner) {
		if (pending.isEmpty()) {
			return;
		}
		for (SyntaxToken token : pending) {
			owner.getForm().addBeforeActive(token);
		}
		pending.clear();
	}

	private void finish(ReadingState state) {
		state.pop();
		if (root == null) {
			receiver.handleReceivedTokenSkip();
		} else {
			if (hole != null) {
				hole.handleReceivedTokenSkip();
			}
			receiver.handleReceivedToken(root);
		}
		List<SyntaxToken> held = new ArrayList<>(pending);
		pending.clear();
		for (SyntaxToken token : held) {
			state.passString(token.toOriginalString());
		}
	}

	private final class RootHole implements TokenReceiver<Expression> {

		@Override
		public void handleReceivedToken(Expression token) {
			root = token;
		}

		@Override
		public void handleReceivedTokenSkip() {
			root = null;
		}
	}
}
