package gdreader.syntax.expressions;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.declarations.TypeNode;
import gdreader.syntax.lists.ParametersList;
import gdreader.syntax.lists.StatementsList;
import gdreader.syntax.tokens.CloseBracket;
import gdreader.syntax.tokens.Colon;
import gdreader.syntax.tokens.Identifier;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;
import gdreader.syntax.tokens.OpenBracket;

/**
 * An anonymous or named function used as a value: <code>func(x): return x * 2</code>.
 *
 * A body on the same line ends at the line break or at a bracket or comma that closes the
 * surrounding construct, as in <code>connect(func(): pass)</code>. A body on the following lines
 * is indented past the line the lambda starts on.
 */
public final class LambdaExpression extends Expression {

	static final String CLOSING_CHARS = ")]},";

	public enum State {
		FUNC,
		IDENTIFIER,
		OPEN_BRACKET,
		PARAMETERS,
		CLOSE_BRACKET,
		RETURN_TYPE_KEYWORD,
		RETURN_TYPE,
		COLON,
		STATEMENTS,
		COMPLETED
	}

	public static final Slot<State, Keyword> FUNC = Slot.of(State.FUNC, Keyword.class);
	public static final Slot<State, Identifier> IDENTIFIER = Slot.of(State.IDENTIFIER, Identifier.class);
	public static final Slot<State, OpenBracket> OPEN_BRACKET = Slot.of(State.OPEN_BRACKET, OpenBracket.class);
	public static final Slot<State, ParametersList> PARAMETERS = Slot.of(State.PARAMETERS, ParametersList.class);
	public static final Slot<State, CloseBracket> CLOSE_BRACKET = Slot.of(State.CLOSE_BRACKET, CloseBracket.class);
	public static final Slot<State, Keyword> RETURN_TYPE_KEYWORD = Slot.of(State.RETURN_TYPE_KEYWORD, Keyword.class);
	public static final Slot<State, TypeNode> RETURN_TYPE = Slot.of(State.RETURN_TYPE, TypeNode.class);
	public static final Slot<State, Colon> COLON = Slot.of(State.COLON, Colon.class);
	public static final Slot<State, StatementsList> STATEMENTS = Slot.of(State.STATEMENTS, StatementsList.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);
	private final int intendation;

	/**
	 * @param intendation column of the line the lambda starts on
	 */
	public LambdaExpression(int intendation) {
		this.intendation = intendation;
		form.receive(FUNC, new Keyword(KeywordKind.FUNC));
	}

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public int getIntendation() {
		return intendation;
	}

	public Identifier getIdentifier() {
		return form.get(IDENTIFIER);
	}

	public void setIdentifier(Identifier value) {
		form.set(IDENTIFIER, value);
	}

	public ParametersList getParameters() {
		return form.getOrCreate(PARAMETERS, ParametersList::new);
	}

	public void setParameters(ParametersList value) {
		form.set(PARAMETERS, value);
	}

	public TypeNode getReturnType() {
		return form.get(RETURN_TYPE);
	}

	public void setReturnType(TypeNode value) {
		form.set(RETURN_TYPE, value);
	}

	public StatementsList getStatements() {
		return form.getOrCreate(STATEMENTS, this::newBody);
	}

	public void setStatements(StatementsList value) {
		form.set(STATEMENTS, value);
	}

	private StatementsList newBody() {
		return new StatementsList(intendation, CLOSING_CHARS);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (Chars.isSpace(c) && !form.isCompleted()) {
			readSpace(c, state);
			return;
		}
		switch (form.getState()) {
			case IDENTIFIER:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, IDENTIFIER, new Identifier(), c, state);
					return;
				}
				form.skip(IDENTIFIER);
				handleChar(c, state);
				return;
			case OPEN_BRACKET:
				if (c == '(') {
					form.receive(OPEN_BRACKET, new OpenBracket());
					return;
				}
				form.skip(OPEN_BRACKET);
				form.skip(PARAMETERS);
				form.skip(CLOSE_BRACKET);
				handleChar(c, state);
				return;
			case PARAMETERS:
				if (c == ')') {
					form.skip(PARAMETERS);
					handleChar(c, state);
					return;
				}
				readInto(form, PARAMETERS, new ParametersList(), c, state);
				return;
			case CLOSE_BRACKET:
				if (c == ')') {
					form.receive(CLOSE_BRACKET, new CloseBracket());
					return;
				}
				form.skip(CLOSE_BRACKET);
				handleChar(c, state);
				return;
			case RETURN_TYPE_KEYWORD:
				if (c == '-') {
					readKeyword(KeywordKind.ARROW, form.receiver(RETURN_TYPE_KEYWORD), c, state);
					return;
				}
				form.skip(RETURN_TYPE_KEYWORD);
				form.skip(RETURN_TYPE);
				handleChar(c, state);
				return;
			case RETURN_TYPE:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, RETURN_TYPE, new TypeNode(), c, state);
					return;
				}
				form.skip(RETURN_TYPE);
				handleChar(c, state);
				return;
			case COLON:
				if (c == ':') {
					form.receive(COLON, new Colon());
					return;
				}
				form.skip(COLON);
				form.complete();
				break;
			case STATEMENTS:
				if (CLOSING_CHARS.indexOf(c) >= 0) {
					form.skip(STATEMENTS);
					break;
				}
				readInto(form, STATEMENTS, newBody(), c, state);
				return;
			default:
				break;
		}
		state.popAndPass(c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		switch (form.getState()) {
			case PARAMETERS:
				form.receive(PARAMETERS, state.push(new ParametersList()));
				state.passNewLine();
				return;
			case CLOSE_BRACKET:
				if (form.get(OPEN_BRACKET) != null) {
					readNewLine();
					return;
				}
				break;
			case STATEMENTS:
				form.receive(STATEMENTS, state.push(newBody()));
				state.passNewLine();
				return;
			default:
				break;
		}
		form.complete();
		state.popAndPassNewLine();
	}
}
