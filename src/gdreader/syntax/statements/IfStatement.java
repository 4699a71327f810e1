package gdreader.syntax.statements;

import gdreader.reader.NextLineResolver;
import gdreader.reader.ReadingState;
import gdreader.syntax.IncidentalTokens;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.tokens.KeywordKind;

/**
 * <code>if</code> with any number of <code>elif</code> branches and an optional <code>else</code>.
 *
 * After each branch the statement looks at the next line: a branch keyword at the column of the
 * <code>if</code> continues the statement; anything else ends it and goes back to the enclosing body.
 */
public final class IfStatement extends Statement {

	public enum State {
		IF_BRANCH,
		ELIF_BRANCHES,
		ELSE_BRANCH,
		COMPLETED
	}

	public static final Slot<State, IfBranch> IF_BRANCH = Slot.of(State.IF_BRANCH, IfBranch.class);
	public static final Slot<State, ElifBranchesList> ELIF_BRANCHES = Slot.of(State.ELIF_BRANCHES, ElifBranchesList.class);
	public static final Slot<State, ElseBranch> ELSE_BRANCH = Slot.of(State.ELSE_BRANCH, ElseBranch.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);
	private final int intendation;

	public IfStatement(int intendation) {
		this.intendation = intendation;
	}

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public int getIntendation() {
		return intendation;
	}

	public IfBranch getIfBranch() {
		return form.get(IF_BRANCH);
	}

	public void setIfBranch(IfBranch value) {
		form.set(IF_BRANCH, value);
	}

	public ElifBranchesList getElifBranches() {
		return form.getOrCreate(ELIF_BRANCHES, ElifBranchesList::new);
	}

	public void setElifBranches(ElifBranchesList value) {
		form.set(ELIF_BRANCHES, value);
	}

	public ElseBranch getElseBranch() {
		return form.get(ELSE_BRANCH);
	}

	public void setElseBranch(ElseBranch value) {
		form.set(ELSE_BRANCH, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		if (form.getState() == State.IF_BRANCH) {
			readInto(form, IF_BRANCH, new IfBranch(intendation), c, state);
			return;
		}
		form.complete();
		state.popAndPass(c);
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		if (form.getState() == State.ELIF_BRANCHES) {
			state.push(new NextLineResolver(this::handleNextLine));
			state.passNewLine();
			return;
		}
		form.complete();
		state.popAndPassNewLine();
	}

	private boolean handleNextLine(String whitespace, String word, int column, ReadingState state) {
		if (column == intendation && form.getState() == State.ELIF_BRANCHES) {
			if (word.equals(KeywordKind.ELIF.getSequence())) {
				ElifBranchesList branches = getElifBranches();
				IncidentalTokens.addBeforeActive(branches.getForm(), whitespace);
				ElifBranch branch = new ElifBranch(intendation);
				branches.getForm().add(branch);
				state.push(branch);
				return true;
			}
			if (word.equals(KeywordKind.ELSE.getSequence())) {
				form.setState(State.ELSE_BRANCH);
				IncidentalTokens.addBeforeActive(form, whitespace);
				ElseBranch branch = new ElseBranch(intendation);
				form.receive(ELSE_BRANCH, branch);
				state.push(branch);
				return true;
			}
		}
		form.complete();
		state.pop();
		return false;
	}
}
