package gdreader.syntax.declarations;

import gdreader.reader.ReadingState;
import gdreader.syntax.Node;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.lists.ClassMembersList;
import gdreader.syntax.tokens.InvalidToken;

/**
 * The root of a script: the members of the class the file declares.
 */
public final class ClassDeclaration extends Node {

	public enum State {
		MEMBERS,
		COMPLETED
	}

	public static final Slot<State, ClassMembersList> MEMBERS = Slot.of(State.MEMBERS, ClassMembersList.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public ClassMembersList getMembers() {
		return form.getOrCreate(MEMBERS, () -> new ClassMembersList(-1));
	}

	public void setMembers(ClassMembersList value) {
		form.set(MEMBERS, value);
	}

	private boolean startMembers(ReadingState state) {
		if (form.getState() != State.MEMBERS) {
			return false;
		}
		form.receive(MEMBERS, state.push(new ClassMembersList(-1)));
		return true;
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (startMembers(state)) {
			state.passChar(c);
		} else {
			// the member list takes every line, so nothing should get here
			readInvalid(InvalidToken.untilLineEnd(), c, state);
		}
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		if (startMembers(state)) {
			state.passNewLine();
		} else {
			readNewLine();
		}
	}

	@Override
	public void handleSharpChar(ReadingState state) {
		if (startMembers(state)) {
			state.passChar('#');
		} else {
			super.handleSharpChar(state);
		}
	}

	@Override
	public void handleCarriageReturnChar(ReadingState state) {
		if (startMembers(state)) {
			state.passCarriageReturn();
		} else {
			super.handleCarriageReturnChar(state);
		}
	}

	@Override
	public void handleLeftSlashChar(ReadingState state) {
		if (startMembers(state)) {
			state.passChar('\\');
		} else {
			super.handleLeftSlashChar(state);
		}
	}
}
