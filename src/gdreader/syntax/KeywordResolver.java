package gdreader.syntax;

import gdreader.reader.ReadingState;
import gdreader.reader.SequenceResolver;
import gdreader.reader.SequenceTable;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Reads one expected keyword. On success the receiver gets the keyword; otherwise it is told the
 * keyword is absent and every buffered character goes back to the node below.
 */
public final class KeywordResolver extends SequenceResolver {

	private static final Map<KeywordKind, SequenceTable> TABLES;

	static {
		Map<KeywordKind, SequenceTable> tables = new EnumMap<>(KeywordKind.class);
		for (KeywordKind kind : KeywordKind.values()) {
			tables.put(kind, SequenceTable.of(kind.getSequence()));
		}
		TABLES = Collections.unmodifiableMap(tables);
	}

	private final KeywordKind kind;
	private final TokenReceiver<Keyword> receiver;

	public KeywordResolver(KeywordKind kind, TokenReceiver<Keyword> receiver) {
		this.kind = kind;
		this.receiver = receiver;
	}

	@Override
	protected SequenceTable getTable() {
		return TABLES.get(kind);
	}

	@Override
	protected boolean onMatch(String sequence, ReadingState state) {
		receiver.handleReceivedToken(new Keyword(kind));
		return true;
	}

	@Override
	protected void onNoMatch(ReadingState state) {
		receiver.handleReceivedTokenSkip();
	}
}
