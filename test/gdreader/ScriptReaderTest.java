package gdreader;

import gdreader.errors.InvalidTokenIssue;
import gdreader.errors.Issue;
import gdreader.errors.TopLevelIssueContext;
import gdreader.errors.UnterminatedStringIssue;
import gdreader.syntax.declarations.ClassDeclaration;
import gdreader.syntax.tokens.InvalidToken;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Paths;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class ScriptReaderTest extends ReaderTestBase {

	private static TopLevelIssueContext issues(String source) {
		ClassDeclaration root = ScriptReader.parse(source);
		TopLevelIssueContext ctx = new TopLevelIssueContext(source);
		ScriptReader.collectIssues(root, ctx);
		return ctx;
	}

	@Test
	public void testEmptyScript() {
		ClassDeclaration root = ScriptReader.parse("");
		assertThat(root.toOriginalString(), is(""));
		assertThat(root.getMembers().getItems().size(), is(0));
	}

	@Test
	public void testValidScriptsHaveNoIssues() throws IOException {
		for (String name : new String[]{"player.gd", "statements.gd", "inner_class.gd", "crlf.gd", "godot4.gd"}) {
			TopLevelIssueContext ctx = issues(readScript(name));
			assertFalse(name + ": " + ctx.format(), ctx.hasErrors());
		}
	}

	@Test
	public void testInvalidScriptReportsIssues() throws IOException {
		TopLevelIssueContext ctx = issues(readScript("invalid.gd"));
		assertTrue(ctx.hasErrors());
		int unterminated = 0;
		for (Issue issue : ctx.getIssues()) {
			if (issue instanceof UnterminatedStringIssue) {
				unterminated++;
			} else {
				assertThat(issue, instanceOf(InvalidTokenIssue.class));
			}
		}
		assertThat(unterminated, is(1));
		assertThat(ctx.format(), containsString("Detected " + ctx.getIssues().size() + " issue(s):"));
	}

	@Test
	public void testInvalidLinePosition() {
		TopLevelIssueContext ctx = issues("extends Node\n$ weird line\n");
		assertThat(ctx.getIssues().size(), is(1));
		InvalidTokenIssue issue = (InvalidTokenIssue) ctx.getIssues().get(0);
		assertThat(issue.getToken().getSequence(), is("$ weird line"));
		assertThat(issue.getLocation().getStartLine(), is(1));
		assertThat(issue.getLocation().getStartColumn(), is(0));
		assertThat(issue.getMessage(), containsString("unexpected text \"$ weird line\" at 2:1"));
	}

	@Test
	public void testStaticWithoutFunc() {
		ClassDeclaration root = parseChecked("static signal broken\n");
		boolean found = false;
		for (InvalidToken token : root.getAllInvalidTokens()) {
			found |= token.getSequence().startsWith("signal");
		}
		assertTrue(found);
	}

	@Test
	public void testInvalidVariableName() {
		ClassDeclaration root = parseChecked("var 123invalid = 5\nvar ok = 1\n");
		InvalidToken invalid = root.getAllInvalidTokens().iterator().next();
		assertThat(invalid.getSequence(), is("123invalid = 5"));
		assertThat(root.getMembers().getItems().size(), is(2));
	}

	@Test(expected = ScriptReadException.class)
	public void testMissingFile() {
		ScriptReader.parseFile(Paths.get("test", "scripts", "missing.gd"));
	}
}
