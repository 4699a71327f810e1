package gdreader.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Children of a list node: any number of items of type T, interleaved with incidental tokens
 * such as commas, spaces and line breaks.
 */
public final class TokensListForm<T extends SyntaxToken> extends AbstractTokensForm {

	private final List<SyntaxToken> all = new ArrayList<>();
	private final List<T> items = new ArrayList<>();

	public TokensListForm(Node owner) {
		super(owner);
	}

	public List<T> getItems() {
		return Collections.unmodifiableList(items);
	}

	public int getItemsCount() {
		return items.size();
	}

	public T getItem(int index) {
		return items.get(index);
	}

	public T getLastItem() {
		return items.isEmpty() ? null : items.get(items.size() - 1);
	}

	public boolean isItem(SyntaxToken token) {
		for (T item : items) {
			if (item == token) {
				return true;
			}
		}
		return false;
	}

	public void add(T item) {
		attach(item);
		all.add(item);
		items.add(item);
	}

	/**
	 * Inserts an item so that it becomes the item at <code>index</code>. It is placed right before
	 * the item currently there, after any incidental tokens that precede that item.
	 */
	public void add(int index, T item) {
		if (index == items.size()) {
			add(item);
			return;
		}
		T current = items.get(index);
		attach(item);
		all.add(indexOf(current), item);
		items.add(index, item);
	}

	@Override
	public void addBeforeActive(SyntaxToken token) {
		addToEnd(token);
	}

	@Override
	public void addToEnd(SyntaxToken token) {
		attach(token);
		all.add(token);
	}

	@Override
	public boolean remove(SyntaxToken token) {
		int i = indexOf(token);
		if (i < 0) {
			return false;
		}
		all.remove(i);
		for (int j = 0; j < items.size(); j++) {
			if (items.get(j) == token) {
				items.remove(j);
				break;
			}
		}
		detach(token);
		return true;
	}

	private int indexOf(SyntaxToken token) {
		for (int i = 0; i < all.size(); i++) {
			if (all.get(i) == token) {
				return i;
			}
		}
		return -1;
	}

	@Override
	public int size() {
		return all.size();
	}

	@Override
	public Iterator<SyntaxToken> iterator() {
		return Collections.unmodifiableList(all).iterator();
	}

	public <R extends T> TokenReceiver<R> itemReceiver() {
		return new TokenReceiver<R>() {
			@Override
			public void handleReceivedToken(R token) {
				add(token);
			}

			@Override
			public void handleReceivedTokenSkip() {
				// an absent item leaves no trace
			}
		};
	}
}
