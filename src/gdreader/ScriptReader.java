package gdreader;

import gdreader.errors.InvalidTokenIssue;
import gdreader.errors.IssueContext;
import gdreader.errors.UnterminatedStringIssue;
import gdreader.reader.ReadingState;
import gdreader.syntax.Node;
import gdreader.syntax.SyntaxToken;
import gdreader.syntax.TreeIterables;
import gdreader.syntax.declarations.ClassDeclaration;
import gdreader.syntax.expressions.StringExpression;
import gdreader.syntax.tokens.InvalidToken;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point: turns script text into a lossless tree rooted at a {@link ClassDeclaration}.
 *
 * Reading never fails on bad input. Text that fits nowhere ends up in {@link InvalidToken}s, and
 * the tree always prints back to exactly the text it was read from.
 */
public final class ScriptReader {

	private static final Logger logger = Logger.getLogger("ScriptReader");

	private ScriptReader() {
	}

	public static ClassDeclaration parse(String source) {
		return parse(source, new ReaderSettings());
	}

	public static ClassDeclaration parse(String source, ReaderSettings settings) {
		ReadingState state = new ReadingState(settings);
		ClassDeclaration root = state.push(new ClassDeclaration());
		state.passString(source);
		state.complete();
		if (logger.isLoggable(Level.FINE)) {
			int invalid = 0;
			for (InvalidToken ignored : root.getAllInvalidTokens()) {
				invalid++;
			}
			logger.fine("read " + source.length() + " chars, " + invalid + " invalid token(s)");
		}
		return root;
	}

	public static ClassDeclaration parseFile(Path path) throws ScriptReadException {
		return parseFile(path, new ReaderSettings());
	}

	public static ClassDeclaration parseFile(Path path, ReaderSettings settings) throws ScriptReadException {
		String source;
		try {
			source = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new ScriptReadException("could not read " + path + ": " + e.getMessage(), e);
		}
		logger.info("reading script " + path);
		return parse(source, settings);
	}

	/**
	 * Reports every invalid token and every unterminated string under <code>root</code>, in
	 * document order. The leftover body of an unterminated string is reported once, as the string.
	 */
	public static void collectIssues(Node root, IssueContext ctx) {
		for (SyntaxToken token : TreeIterables.descendants(root)) {
			if (token instanceof InvalidToken && !(token.getParent() instanceof StringExpression)) {
				ctx.error(new InvalidTokenIssue((InvalidToken) token));
			} else if (token instanceof StringExpression && !((StringExpression) token).isTerminated()) {
				ctx.error(new UnterminatedStringIssue((StringExpression) token));
			}
		}
	}
}
