package gdreader.syntax;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy views over a subtree. Every view can be iterated again; it walks the tree as it is at that
 * moment.
 */
public final class TreeIterables {

	private TreeIterables() {
	}

	/**
	 * All descendants of a node in document order, each node before its own children.
	 */
	public static Iterable<SyntaxToken> descendants(Node node) {
		return () -> new DescendantsIterator(node);
	}

	public static <T extends SyntaxToken> Iterable<T> descendants(Node node, Class<T> type) {
		return filter(descendants(node), type);
	}

	public static <T extends SyntaxToken> Iterable<T> filter(Iterable<SyntaxToken> source, Class<T> type) {
		return () -> new Iterator<T>() {
			private final Iterator<SyntaxToken> inner = source.iterator();
			private T next = advance();

			private T advance() {
				while (inner.hasNext()) {
					SyntaxToken t = inner.next();
					if (type.isInstance(t)) {
						return type.cast(t);
					}
				}
				return null;
			}

			@Override
			public boolean hasNext() {
				return next != null;
			}

			@Override
			public T next() {
				if (next == null) {
					throw new NoSuchElementException();
				}
				T current = next;
				next = advance();
				return current;
			}
		};
	}

	private static final class DescendantsIterator implements Iterator<SyntaxToken> {

		private final Deque<Iterator<SyntaxToken>> stack = new ArrayDeque<>();

		DescendantsIterator(Node root) {
			stack.push(root.getForm().iterator());
		}

		@Override
		public boolean hasNext() {
			while (!stack.isEmpty()) {
				if (stack.peek().hasNext()) {
					return true;
				}
				stack.pop();
			}
			return false;
		}

		@Override
		public SyntaxToken next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			SyntaxToken t = stack.peek().next();
			if (t instanceof Node) {
				stack.push(((Node) t).getForm().iterator());
			}
			return t;
		}
	}
}
