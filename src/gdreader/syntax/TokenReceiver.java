package gdreader.syntax;

/**
 * Notified when a child of type T finishes reading, or when the driver decided the optional
 * child is absent.
 */
public interface TokenReceiver<T extends SyntaxToken> {

	void handleReceivedToken(T token);

	void handleReceivedTokenSkip();
}
