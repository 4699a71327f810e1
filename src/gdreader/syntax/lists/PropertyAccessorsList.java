package gdreader.syntax.lists;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.declarations.PropertyAccessor;
import gdreader.syntax.tokens.Comma;

/**
 * The <code>get</code> and <code>set</code> accessors of a property. Accessors that name a method
 * may share a line, separated by commas.
 */
public final class PropertyAccessorsList extends IntendedTokensList<PropertyAccessor> {

	public PropertyAccessorsList(int parentColumn) {
		super(parentColumn);
	}

	@Override
	protected void startItem(char c, ReadingState state) {
		if (c == ',') {
			getForm().addToEnd(new Comma());
		} else if (Chars.isIdentifierStart(c)) {
			startWord(c, state);
		} else {
			readInvalidLine(c, state);
		}
	}

	@Override
	protected void startItemWithWord(String word, ReadingState state) {
		if (PropertyAccessor.isAccessorName(word)) {
			pushItem(new PropertyAccessor(getLineColumn()), word, state);
		} else {
			readInvalidLine(word, state);
		}
	}
}
