package gdreader.syntax.statements;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.declarations.TypeNode;
import gdreader.syntax.expressions.Expression;
import gdreader.syntax.expressions.ExpressionResolver;
import gdreader.syntax.lists.StatementsList;
import gdreader.syntax.tokens.Colon;
import gdreader.syntax.tokens.Identifier;
import gdreader.syntax.tokens.InvalidToken;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

/**
 * <code>for item in collection:</code> or <code>for item: Type in collection:</code>, followed by a body.
 */
public final class ForStatement extends Statement {

	public enum State {
		FOR,
		VARIABLE,
		TYPE_COLON,
		TYPE,
		IN,
		COLLECTION,
		COLON,
		STATEMENTS,
		COMPLETED
	}

	public static final Slot<State, Keyword> FOR = Slot.of(State.FOR, Keyword.class);
	public static final Slot<State, Identifier> VARIABLE = Slot.of(State.VARIABLE, Identifier.class);
	public static final Slot<State, Colon> TYPE_COLON = Slot.of(State.TYPE_COLON, Colon.class);
	public static final Slot<State, TypeNode> TYPE = Slot.of(State.TYPE, TypeNode.class);
	public static final Slot<State, Keyword> IN = Slot.of(State.IN, Keyword.class);
	public static final Slot<State, Expression> COLLECTION = Slot.of(State.COLLECTION, Expression.class);
	public static final Slot<State, Colon> COLON = Slot.of(State.COLON, Colon.class);
	public static final Slot<State, StatementsList> STATEMENTS = Slot.of(State.STATEMENTS, StatementsList.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);
	private final int intendation;

	public ForStatement(int intendation) {
		this.intendation = intendation;
	}

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Identifier getVariable() {
		return form.get(VARIABLE);
	}

	public void setVariable(Identifier value) {
		form.set(VARIABLE, value);
	}

	public TypeNode getVariableType() {
		return form.get(TYPE);
	}

	public void setVariableType(TypeNode value) {
		form.set(TYPE, value);
	}

	public Expression getCollection() {
		return form.get(COLLECTION);
	}

	public void setCollection(Expression value) {
		form.set(COLLECTION, value);
	}

	public StatementsList getStatements() {
		return form.getOrCreate(STATEMENTS, () -> new StatementsList(intendation));
	}

	public void setStatements(StatementsList value) {
		form.set(STATEMENTS, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (Chars.isSpace(c) && form.getState() != State.FOR && !form.isCompleted()) {
			readSpace(c, state);
			return;
		}
		switch (form.getState()) {
			case FOR:
				readKeyword(KeywordKind.FOR, form.receiver(FOR), c, state);
				return;
			case VARIABLE:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, VARIABLE, new Identifier(), c, state);
					return;
				}
				form.skip(VARIABLE);
				handleChar(c, state);
				return;
			case TYPE_COLON:
				if (c == ':') {
					form.receive(TYPE_COLON, new Colon());
					return;
				}
				form.skip(TYPE_COLON);
				form.skip(TYPE);
				handleChar(c, state);
				return;
			case TYPE:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, TYPE, new TypeNode(), c, state);
					return;
				}
				form.skip(TYPE);
				handleChar(c, state);
				return;
			case IN:
				if (c == 'i') {
					readKeyword(KeywordKind.IN, form.receiver(IN), c, state);
					return;
				}
				form.skip(IN);
				handleChar(c, state);
				return;
			case COLLECTION:
				if (Chars.isExpressionStart(c)) {
					state.push(new ExpressionResolver(form.receiver(COLLECTION)));
					state.passChar(c);
					return;
				}
				form.skip(COLLECTION);
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
