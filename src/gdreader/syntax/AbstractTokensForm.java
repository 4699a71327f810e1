package gdreader.syntax;

/**
 * The ordered children of a node: grammar slots or list items, interleaved with incidental tokens
 * (spaces, comments, line breaks) that only matter for reproducing the text.
 */
public abstract class AbstractTokensForm implements Iterable<SyntaxToken> {

	protected final Node owner;

	protected AbstractTokensForm(Node owner) {
		this.owner = owner;
	}

	public Node getOwner() {
		return owner;
	}

	/**
	 * Records an incidental token right before the child currently expected.
	 */
	public abstract void addBeforeActive(SyntaxToken token);

	/**
	 * Records an incidental token after every other child.
	 */
	public abstract void addToEnd(SyntaxToken token);

	/**
	 * Detaches a direct child. A slot keeps its place and becomes empty.
	 *
	 * @return false if the token is not a child of this form
	 */
	public abstract boolean remove(SyntaxToken token);

	public abstract int size();

	protected void attach(SyntaxToken token) {
		if (token == null) {
			return;
		}
		Node previous = token.getParent();
		if (previous != null && previous != owner) {
			previous.getForm().remove(token);
		}
		token.setParent(owner);
	}

	protected void detach(SyntaxToken token) {
		if (token != null && token.getParent() == owner) {
			token.setParent(null);
		}
	}
}
