package gdreader.syntax.expressions;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.NodePath;
import gdreader.syntax.tokens.NodePathSign;

/**
 * Node lookup shorthand: <code>$Body/Sprite</code>, <code>$"../Sibling"</code>, <code>%Label</code>.
 * The path is either unquoted or a string literal; never both.
 */
public final class GetNodeExpression extends Expression {

	public enum State {
		SIGN,
		PATH,
		STRING,
		COMPLETED
	}

	public static final Slot<State, NodePathSign> SIGN = Slot.of(State.SIGN, NodePathSign.class);
	public static final Slot<State, NodePath> PATH = Slot.of(State.PATH, NodePath.class);
	public static final Slot<State, StringExpression> STRING = Slot.of(State.STRING, StringExpression.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public NodePathSign getSign() {
		return form.get(SIGN);
	}

	public boolean isUniqueName() {
		NodePathSign sign = getSign();
		return sign != null && sign.isUniqueName();
	}

	public NodePath getPath() {
		return form.get(PATH);
	}

	public void setPath(NodePath value) {
		form.set(PATH, value);
	}

	public StringExpression getString() {
		return form.get(STRING);
	}

	public void setString(StringExpression value) {
		form.set(STRING, value);
	}

	/**
	 * The path as written, without quotes, or an empty string if none was read.
	 */
	public String getPathText() {
		NodePath path = getPath();
		if (path != null) {
			return path.getSequence();
		}
		StringExpression string = getString();
		return string == null ? "" : string.getRawValue();
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (form.getState()) {
			case SIGN:
				form.receive(SIGN, new NodePathSign(c));
				return;
			case PATH:
				if (isUniqueName() ? Chars.isIdentifierStart(c) : NodePath.isPathStart(c)) {
					NodePath path = new NodePath();
					form.receiver(PATH, State.COMPLETED).handleReceivedToken(path);
					state.push(path);
					state.passChar(c);
					return;
				}
				form.skip(PATH);
				handleChar(c, state);
				return;
			case STRING:
				if (Chars.isQuote(c) && !isUniqueName()) {
					readInto(form, STRING, new StringExpression(), c, state);
					return;
				}
				form.skip(STRING);
				break;
			default:
				break;
		}
		state.popAndPass(c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		form.complete();
		state.popAndPassNewLine();
	}

	@Override
	public void handleSharpChar(ReadingState state) {
		form.complete();
		super.handleSharpChar(state);
	}
}
