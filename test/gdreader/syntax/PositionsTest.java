package gdreader.syntax;

import gdreader.ReaderTestBase;
import gdreader.ScriptReader;
import gdreader.syntax.declarations.ClassDeclaration;
import gdreader.syntax.declarations.VariableDeclaration;
import gdreader.syntax.tokens.Identifier;
import gdreader.util.SourceLocation;
import org.junit.Test;

import java.io.IOException;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class PositionsTest extends ReaderTestBase {

	// leaves cover the text without gaps or overlaps
	@Test
	public void testLeavesAreContiguous() throws IOException {
		for (String name : new String[]{"player.gd", "crlf.gd", "invalid.gd"}) {
			String source = readScript(name);
			ClassDeclaration root = ScriptReader.parse(source);
			int offset = 0;
			for (SyntaxToken token : root.getAllTokens()) {
				if (token instanceof Node) {
					continue;
				}
				assertThat(name, token.getStartOffset(), is(offset));
				offset = token.getEndOffset();
				assertThat(source.substring(token.getStartOffset(), offset), is(token.toOriginalString()));
			}
			assertThat(offset, is(source.length()));
		}
	}

	@Test
	public void testLineAndColumn() {
		ClassDeclaration root = parseChecked("extends Node\nvar speed = 1\n");
		VariableDeclaration speed = (VariableDeclaration) member(root, 1);
		Identifier identifier = speed.getIdentifier();
		assertThat(identifier.getStartLine(), is(1));
		assertThat(identifier.getStartColumn(), is(4));
		assertThat(identifier.getEndColumn(), is(9));
		assertTrue(identifier.containsPosition(1, 6));
		assertFalse(identifier.containsPosition(0, 6));
		SourceLocation location = speed.getLocation();
		assertThat(location.getStartOffset(), is(13));
		assertThat(location.getEndOffset(), is(26));
	}

	// positions follow edits made after reading
	@Test
	public void testPositionsAfterEdit() {
		ClassDeclaration root = parseChecked("var a = 1\nvar b = 2\n");
		VariableDeclaration a = (VariableDeclaration) member(root, 0);
		VariableDeclaration b = (VariableDeclaration) member(root, 1);
		assertThat(b.getIdentifier().getStartOffset(), is(14));
		a.setIdentifier(new Identifier("longer"));
		assertThat(root.toOriginalString(), is("var longer = 1\nvar b = 2\n"));
		assertThat(b.getIdentifier().getStartOffset(), is(19));
		assertThat(b.getIdentifier().getStartLine(), is(1));
	}

	@Test
	public void testNavigation() {
		ClassDeclaration root = parseChecked("var a = 1\n");
		VariableDeclaration a = (VariableDeclaration) member(root, 0);
		Identifier identifier = a.getIdentifier();
		assertThat(identifier.getPreviousToken().toOriginalString(), is(" "));
		assertThat(identifier.getNextToken().toOriginalString(), is(" "));
		assertThat(identifier.getRoot(), is((Node) root));
	}

	@Test
	public void testNavigationAcrossNodes() {
		ClassDeclaration root = parseChecked("var a = 1\nvar b = 2\n");
		VariableDeclaration a = (VariableDeclaration) member(root, 0);
		VariableDeclaration b = (VariableDeclaration) member(root, 1);
		assertThat(a.getNextNode(), is((Node) b));
		assertThat(b.getPreviousNode(), is((Node) a));
		SyntaxToken lastOfA = a.getLastToken();
		assertThat(lastOfA.toOriginalString(), is("1"));
		assertThat(lastOfA.getNextTokenInTree().toOriginalString(), is("\n"));
		assertThat(b.getFirstToken().getPreviousTokenInTree().toOriginalString(), is("\n"));
	}
}
