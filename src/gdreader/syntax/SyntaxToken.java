package gdreader.syntax;

import gdreader.InternalParserError;
import gdreader.reader.CharReader;
import gdreader.util.SourceLocation;

/**
 * Common base of every element of the tree, leaves and nodes alike.
 *
 * Positions are never stored. They are computed from the text of the preceding siblings and
 * ancestors, so they stay correct after the tree is edited. Lines and columns are 0-based and
 * measured over the exact text: every character except '\n' advances the column by one.
 */
public abstract class SyntaxToken extends CharReader {

	private Node parent;

	public Node getParent() {
		return parent;
	}

	void setParent(Node parent) {
		this.parent = parent;
	}

	/**
	 * Appends the exact text of this element.
	 */
	public abstract void appendTo(StringBuilder builder);

	/**
	 * The exact text this element was read from, carriage returns included.
	 */
	public String toOriginalString() {
		StringBuilder builder = new StringBuilder();
		appendTo(builder);
		return builder.toString();
	}

	/**
	 * The text with carriage returns dropped.
	 */
	@Override
	public String toString() {
		String original = toOriginalString();
		if (original.indexOf('\r') < 0) {
			return original;
		}
		return original.replace("\r", "");
	}

	public int getLength() {
		return toString().length();
	}

	public int getOriginLength() {
		return toOriginalString().length();
	}

	public int getNewLinesCount() {
		String text = toOriginalString();
		int count = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				count++;
			}
		}
		return count;
	}

	public Node getRoot() {
		Node root = this instanceof Node ? (Node) this : parent;
		if (root == null) {
			return null;
		}
		while (root.getParent() != null) {
			root = root.getParent();
		}
		return root;
	}

	/**
	 * Detaches this element from its parent.
	 *
	 * @return false if it had no parent
	 */
	public boolean removeFromParent() {
		return parent != null && parent.getForm().remove(this);
	}

	// positions

	private static final int OFFSET = 0;
	private static final int LINE = 1;
	private static final int COLUMN = 2;

	private int[] startPosition() {
		if (parent == null) {
			return new int[] {0, 0, 0};
		}
		int[] position = ((SyntaxToken) parent).startPosition();
		for (SyntaxToken sibling : parent.getForm()) {
			if (sibling == this) {
				return position;
			}
			advance(position, sibling.toOriginalString());
		}
		throw new InternalParserError(getClass().getSimpleName() + " is not among the children of its parent");
	}

	private static void advance(int[] position, String text) {
		position[OFFSET] += text.length();
		int lastNewLine = text.lastIndexOf('\n');
		if (lastNewLine < 0) {
			position[COLUMN] += text.length();
			return;
		}
		for (int i = 0; i <= lastNewLine; i++) {
			if (text.charAt(i) == '\n') {
				position[LINE]++;
			}
		}
		position[COLUMN] = text.length() - lastNewLine - 1;
	}

	private int[] endPosition() {
		int[] position = startPosition();
		advance(position, toOriginalString());
		return position;
	}

	public int getStartOffset() {
		return startPosition()[OFFSET];
	}

	public int getStartLine() {
		return startPosition()[LINE];
	}

	public int getStartColumn() {
		return startPosition()[COLUMN];
	}

	public int getEndOffset() {
		return endPosition()[OFFSET];
	}

	public int getEndLine() {
		return endPosition()[LINE];
	}

	public int getEndColumn() {
		return endPosition()[COLUMN];
	}

	public SourceLocation getLocation() {
		int[] start = startPosition();
		int[] end = start.clone();
		advance(end, toOriginalString());
		return new SourceLocation(start[OFFSET], end[OFFSET], start[LINE], end[LINE], start[COLUMN], end[COLUMN]);
	}

	public boolean containsPosition(int line, int column) {
		return getLocation().contains(line, column);
	}

	public boolean isInside(int fromLine, int fromColumn, int toLine, int toColumn) {
		return getLocation().isInside(fromLine, fromColumn, toLine, toColumn);
	}

	public boolean overlaps(int fromLine, int fromColumn, int toLine, int toColumn) {
		return getLocation().overlaps(fromLine, fromColumn, toLine, toColumn);
	}

	// navigation

	public SyntaxToken getPreviousToken() {
		if (parent == null) {
			return null;
		}
		SyntaxToken previous = null;
		for (SyntaxToken sibling : parent.getForm()) {
			if (sibling == this) {
				return previous;
			}
			previous = sibling;
		}
		return null;
	}

	public SyntaxToken getNextToken() {
		if (parent == null) {
			return null;
		}
		boolean found = false;
		for (SyntaxToken sibling : parent.getForm()) {
			if (found) {
				return sibling;
			}
			found = sibling == this;
		}
		return null;
	}

	public Node getPreviousNode() {
		SyntaxToken t = getPreviousToken();
		while (t != null && !(t instanceof Node)) {
			t = t.getPreviousToken();
		}
		return (Node) t;
	}

	public Node getNextNode() {
		SyntaxToken t = getNextToken();
		while (t != null && !(t instanceof Node)) {
			t = t.getNextToken();
		}
		return (Node) t;
	}

	/**
	 * The leaf that precedes this element in document order, anywhere in the tree.
	 */
	public SyntaxToken getPreviousTokenInTree() {
		SyntaxToken current = this;
		while (current.getParent() != null) {
			SyntaxToken sibling = current.getPreviousToken();
			while (sibling != null) {
				SyntaxToken leaf = sibling instanceof Node ? ((Node) sibling).getLastToken() : sibling;
				if (leaf != null) {
					return leaf;
				}
				sibling = sibling.getPreviousToken();
			}
			current = current.getParent();
		}
		return null;
	}

	/**
	 * The leaf that follows this element in document order, anywhere in the tree.
	 */
	public SyntaxToken getNextTokenInTree() {
		SyntaxToken current = this;
		while (current.getParent() != null) {
			SyntaxToken sibling = current.getNextToken();
			while (sibling != null) {
				SyntaxToken leaf = sibling instanceof Node ? ((Node) sibling).getFirstToken() : sibling;
				if (leaf != null) {
					return leaf;
				}
				sibling = sibling.getNextToken();
			}
			current = current.getParent();
		}
		return null;
	}
}
