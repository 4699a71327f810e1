package gdreader.formatters;

import gdreader.ScriptReader;
import gdreader.syntax.declarations.ClassDeclaration;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class SyntaxTreeFormatterTest {

	@Test
	public void testFormat() {
		String expected = "ClassDeclaration\n" +
				"  ClassMembersList\n" +
				"    ExtendsAttribute\n" +
				"      Keyword \"extends\"\n" +
				"      Space \" \"\n" +
				"      IdentifierExpression\n" +
				"        Identifier \"Node\"\n" +
				"    NewLine \"\\n\"";
		assertThat(SyntaxTreeFormatter.format(ScriptReader.parse("extends Node\n")), is(expected));
	}

	// blanks between unreadable text and a comment are kept apart from the text
	@Test
	public void testInvalidLineBeforeComment() {
		String source = "x  #comment\n";
		String expected = "ClassDeclaration\n" +
				"  ClassMembersList\n" +
				"    InvalidToken \"x\"\n" +
				"    Space \"  \"\n" +
				"    Comment \"#comment\"\n" +
				"    NewLine \"\\n\"";
		ClassDeclaration root = ScriptReader.parse(source);
		assertThat(SyntaxTreeFormatter.format(root), is(expected));
		assertThat(root.toOriginalString(), is(source));
	}

	@Test
	public void testEscape() {
		assertThat(SyntaxTreeFormatter.escape("a\t\"b\"\\\r\n"), is("a\\t\\\"b\\\"\\\\\\r\\n"));
	}
}
