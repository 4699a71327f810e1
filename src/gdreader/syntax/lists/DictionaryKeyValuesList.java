package gdreader.syntax.lists;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.expressions.DictionaryKeyValue;

public final class DictionaryKeyValuesList extends SeparatedTokensList<DictionaryKeyValue> {

	public DictionaryKeyValuesList() {
		super(true);
	}

	@Override
	protected boolean isItemStart(char c) {
		return Chars.isExpressionStart(c);
	}

	@Override
	protected void startItem(char c, ReadingState state) {
		DictionaryKeyValue item = new DictionaryKeyValue();
		getForm().add(item);
		state.push(item);
		state.passChar(c);
	}

	@Override
	protected String getClosingChars() {
		return "}";
	}
}
