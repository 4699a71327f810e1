package gdreader;

import gdreader.formatters.SyntaxTreeFormatter;
import gdreader.syntax.declarations.ClassDeclaration;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

@RunWith(Parameterized.class)
public class ScriptReaderRoundTripTest extends ReaderTestBase {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{"player.gd"},
				{"statements.gd"},
				{"inner_class.gd"},
				{"crlf.gd"},
				{"godot4.gd"},
				{"invalid.gd"},
		});
	}

	private final String fileName;

	public ScriptReaderRoundTripTest(String fileName) {
		this.fileName = fileName;
	}

	// the tree prints back exactly the text it was read from, bad input included
	@Test
	public void testRoundTrip() throws IOException {
		String source = readScript(fileName);
		ClassDeclaration root = ScriptReader.parse(source);
		assertThat(root.toOriginalString(), is(source));
		assertThat(root.getOriginLength(), is(source.length()));
	}

	// reading the printed tree again gives the same tree
	@Test
	public void testReparse() throws IOException {
		String source = readScript(fileName);
		String first = SyntaxTreeFormatter.format(ScriptReader.parse(source));
		String second = SyntaxTreeFormatter.format(ScriptReader.parse(ScriptReader.parse(source).toOriginalString()));
		assertThat(second, is(first));
	}

	@Test
	public void testParseFile() throws IOException {
		ClassDeclaration root = ScriptReader.parseFile(SCRIPTS.resolve(fileName));
		assertThat(root.toOriginalString(), is(readScript(fileName)));
	}

	// toString drops carriage returns and nothing else
	@Test
	public void testToStringWithoutCarriageReturns() throws IOException {
		String source = readScript(fileName);
		assertThat(ScriptReader.parse(source).toString(), is(source.replace("\r", "")));
	}
}
