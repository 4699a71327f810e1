package gdreader.reader;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * An immutable set of candidate sequences, ordered longest first, used by longest-match readers.
 * Tables are built once per matcher kind and shared.
 */
public final class SequenceTable {

	private final List<String> sequences;

	private SequenceTable(List<String> sequences) {
		this.sequences = sequences;
	}

	public static SequenceTable of(Collection<String> candidates) {
		List<String> sorted = new ArrayList<>(new LinkedHashSet<>(candidates));
		for (String s : sorted) {
			if (s.isEmpty()) {
				throw new IllegalArgumentException("empty sequence");
			}
		}
		sorted.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
		return new SequenceTable(Collections.unmodifiableList(sorted));
	}

	public static SequenceTable of(String... candidates) {
		List<String> list = new ArrayList<>();
		Collections.addAll(list, candidates);
		return of(list);
	}

	public List<String> getSequences() {
		return sequences;
	}

	public boolean canStart(char c) {
		for (String s : sequences) {
			if (s.charAt(0) == c) {
				return true;
			}
		}
		return false;
	}

	/**
	 * True if some candidate starts with the given prefix (or equals it).
	 */
	public boolean hasPrefix(CharSequence prefix) {
		for (String s : sequences) {
			if (s.length() >= prefix.length() && s.regionMatches(0, prefix.toString(), 0, prefix.length())) {
				return true;
			}
		}
		return false;
	}

	/**
	 * The longest candidate that is a prefix of <code>buffer</code>. Candidates ending in an identifier
	 * character only match when the character after them cannot continue an identifier.
	 *
	 * @param next the character following the buffer, or -1 at the end of input
	 * @return the matched candidate, or null
	 */
	public String longestMatch(CharSequence buffer, int next) {
		String text = buffer.toString();
		for (String s : sequences) {
			if (s.length() > text.length() || !text.startsWith(s)) {
				continue;
			}
			if (isWord(s)) {
				int after = s.length() < text.length() ? text.charAt(s.length()) : next;
				if (after >= 0 && Chars.isIdentifierPart((char) after)) {
					continue;
				}
			}
			return s;
		}
		return null;
	}

	private static boolean isWord(String s) {
		return Chars.isIdentifierPart(s.charAt(s.length() - 1));
	}

	@Override
	public String toString() {
		return "SequenceTable" + sequences;
	}
}
