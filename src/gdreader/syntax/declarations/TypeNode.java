package gdreader.syntax.declarations;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Node;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.Identifier;
import gdreader.syntax.tokens.Point;
import gdreader.syntax.tokens.SquareCloseBracket;
import gdreader.syntax.tokens.SquareOpenBracket;

/**
 * A type annotation: <code>int</code>, <code>Array[String]</code>, <code>Outer.Inner</code>.
 */
public final class TypeNode extends Node {

	public enum State {
		NAME,
		SQUARE_OPEN_BRACKET,
		ELEMENT_TYPE,
		SQUARE_CLOSE_BRACKET,
		POINT,
		INNER,
		COMPLETED
	}

	public static final Slot<State, Identifier> NAME = Slot.of(State.NAME, Identifier.class);
	public static final Slot<State, SquareOpenBracket> SQUARE_OPEN_BRACKET = Slot.of(State.SQUARE_OPEN_BRACKET, SquareOpenBracket.class);
	public static final Slot<State, TypeNode> ELEMENT_TYPE = Slot.of(State.ELEMENT_TYPE, TypeNode.class);
	public static final Slot<State, SquareCloseBracket> SQUARE_CLOSE_BRACKET = Slot.of(State.SQUARE_CLOSE_BRACKET, SquareCloseBracket.class);
	public static final Slot<State, Point> POINT = Slot.of(State.POINT, Point.class);
	public static final Slot<State, TypeNode> INNER = Slot.of(State.INNER, TypeNode.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Identifier getName() {
		return form.get(NAME);
	}

	public void setName(Identifier value) {
		form.set(NAME, value);
	}

	public TypeNode getElementType() {
		return form.get(ELEMENT_TYPE);
	}

	public void setElementType(TypeNode value) {
		form.set(ELEMENT_TYPE, value);
	}

	public TypeNode getInner() {
		return form.get(INNER);
	}

	public void setInner(TypeNode value) {
		form.set(INNER, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (form.getState()) {
			case NAME:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, NAME, new Identifier(), c, state);
					return;
				}
				form.complete();
				break;
			case SQUARE_OPEN_BRACKET:
				if (c == '[') {
					form.receive(SQUARE_OPEN_BRACKET, new SquareOpenBracket());
					return;
				}
				if (c == '.') {
					form.setState(State.POINT);
					handleChar(c, state);
					return;
				}
				form.complete();
				break;
			case ELEMENT_TYPE:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, ELEMENT_TYPE, new TypeNode(), c, state);
					return;
				}
				form.skip(ELEMENT_TYPE);
				handleChar(c, state);
				return;
			case SQUARE_CLOSE_BRACKET:
				if (c == ']') {
					form.receive(SQUARE_CLOSE_BRACKET, new SquareCloseBracket());
					return;
				}
				form.complete();
				break;
			case POINT:
				if (c == '.') {
					form.receive(POINT, new Point());
					return;
				}
				form.complete();
				break;
			case INNER:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, INNER, new TypeNode(), c, state);
					return;
				}
				form.complete();
				break;
			default:
				break;
		}
		state.popAndPass(c);
	}

	// a type ends at anything that is not part of its name

	@Override
	public void handleSharpChar(ReadingState state) {
		form.complete();
		super.handleSharpChar(state);
	}

	@Override
	public void handleCarriageReturnChar(ReadingState state) {
		form.complete();
		super.handleCarriageReturnChar(state);
	}

	@Override
	public void handleLeftSlashChar(ReadingState state) {
		form.complete();
		super.handleLeftSlashChar(state);
	}
}
