package gdreader.syntax.lists;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.declarations.ParameterDeclaration;

public final class ParametersList extends SeparatedTokensList<ParameterDeclaration> {

	public ParametersList() {
		super(true);
	}

	@Override
	protected boolean isItemStart(char c) {
		return Chars.isIdentifierStart(c);
	}

	@Override
	protected void startItem(char c, ReadingState state) {
		ParameterDeclaration item = new ParameterDeclaration();
		getForm().add(item);
		state.push(item);
		state.passChar(c);
	}

	@Override
	protected String getClosingChars() {
		return ")";
	}
}
