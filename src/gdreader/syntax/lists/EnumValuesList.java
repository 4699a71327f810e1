package gdreader.syntax.lists;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.declarations.EnumValue;

public final class EnumValuesList extends SeparatedTokensList<EnumValue> {

	public EnumValuesList() {
		super(true);
	}

	@Override
	protected boolean isItemStart(char c) {
		return Chars.isIdentifierStart(c);
	}

	@Override
	protected void startItem(char c, ReadingState state) {
		EnumValue item = new EnumValue();
		getForm().add(item);
		state.push(item);
		state.passChar(c);
	}

	@Override
	protected String getClosingChars() {
		return "}";
	}
}
