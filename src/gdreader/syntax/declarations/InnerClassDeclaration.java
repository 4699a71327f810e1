package gdreader.syntax.declarations;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.lists.ClassMembersList;
import gdreader.syntax.tokens.Colon;
import gdreader.syntax.tokens.Identifier;
import gdreader.syntax.tokens.InvalidToken;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

/**
 * <code>class Name extends Base:</code> followed by an indented block of members.
 */
public final class InnerClassDeclaration extends ClassMember {

	public enum State {
		CLASS,
		IDENTIFIER,
		EXTENDS,
		BASE_TYPE,
		COLON,
		MEMBERS,
		COMPLETED
	}

	public static final Slot<State, Keyword> CLASS = Slot.of(State.CLASS, Keyword.class);
	public static final Slot<State, Identifier> IDENTIFIER = Slot.of(State.IDENTIFIER, Identifier.class);
	public static final Slot<State, Keyword> EXTENDS = Slot.of(State.EXTENDS, Keyword.class);
	public static final Slot<State, TypeNode> BASE_TYPE = Slot.of(State.BASE_TYPE, TypeNode.class);
	public static final Slot<State, Colon> COLON = Slot.of(State.COLON, Colon.class);
	public static final Slot<State, ClassMembersList> MEMBERS = Slot.of(State.MEMBERS, ClassMembersList.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);
	private final int intendation;

	public InnerClassDeclaration(int intendation) {
		this.intendation = intendation;
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

	public TypeNode getBaseType() {
		return form.get(BASE_TYPE);
	}

	public void setBaseType(TypeNode value) {
		form.set(BASE_TYPE, value);
	}

	public ClassMembersList getMembers() {
		return form.getOrCreate(MEMBERS, () -> new ClassMembersList(intendation));
	}

	public void setMembers(ClassMembersList value) {
		form.set(MEMBERS, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (Chars.isSpace(c) && form.getState() != State.CLASS && !form.isCompleted()) {
			readSpace(c, state);
			return;
		}
		switch (form.getState()) {
			case CLASS:
				readKeyword(KeywordKind.CLASS, form.receiver(CLASS), c, state);
				return;
			case IDENTIFIER:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, IDENTIFIER, new Identifier(), c, state);
					return;
				}
				form.skip(IDENTIFIER);
				handleChar(c, state);
				return;
			case EXTENDS:
				if (c == 'e') {
					readKeyword(KeywordKind.EXTENDS, form.receiver(EXTENDS), c, state);
					return;
				}
				form.skip(EXTENDS);
				form.skip(BASE_TYPE);
				handleChar(c, state);
				return;
			case BASE_TYPE:
				if (Chars.isIdentifierStart(c)) {
					readInto(form, BASE_TYPE, new TypeNode(), c, state);
					return;
				}
				form.skip(BASE_TYPE);
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
			case MEMBERS:
				// members start on the next line
				readInvalid(InvalidToken.untilLineEnd(), c, state);
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
		form.setState(State.MEMBERS);
		form.receive(MEMBERS, state.push(new ClassMembersList(intendation)));
		state.passNewLine();
	}
}
