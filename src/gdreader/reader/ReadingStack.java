package gdreader.reader;

import java.util.Optional;

/**
 * A linked stack of readers; push and pop never copy.
 */
public final class ReadingStack<T> {

	private static final class Node<T> {
		public final T value;
		public final Node<T> next;

		public Node(T value, Node<T> next) {
			this.value = value;
			this.next = next;
		}
	}

	private Node<T> root;

	public ReadingStack() {
		this.root = null;
	}

	public T top() { return root != null ? root.value : null; }

	public Optional<T> pop() {
		if(root == null) return Optional.empty();
		T value = root.value;
		root = root.next;
		return Optional.of(value);
	}

	public void push(T value) {
		root = new Node<>(value, root);
	}

	public boolean isEmpty() { return root == null; }
}
