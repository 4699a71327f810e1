package gdreader.syntax.statements;

import gdreader.InternalParserError;
import gdreader.reader.ReadingState;
import gdreader.syntax.Node;
import gdreader.syntax.TokensListForm;

import java.util.List;

/**
 * The <code>elif</code> branches of an if statement, with the line breaks between them. Filled by
 * the statement itself; the list is never read from directly.
 */
public final class ElifBranchesList extends Node {

	private final TokensListForm<ElifBranch> form = new TokensListForm<>(this);

	@Override
	public TokensListForm<ElifBranch> getForm() {
		return form;
	}

	public List<ElifBranch> getItems() {
		return form.getItems();
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		throw new InternalParserError("elif branches are added by their if statement");
	}

	@Override
	public void handleNewLineChar(ReadingState state) {
		throw new InternalParserError("elif branches are added by their if statement");
	}
}
