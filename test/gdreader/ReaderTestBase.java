package gdreader;

import gdreader.syntax.declarations.ClassDeclaration;
import gdreader.syntax.declarations.ClassMember;
import gdreader.syntax.declarations.MethodDeclaration;
import gdreader.syntax.expressions.Expression;
import gdreader.syntax.statements.ExpressionStatement;
import gdreader.syntax.statements.Statement;
import org.apache.commons.io.IOUtils;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.Assert.assertEquals;

public abstract class ReaderTestBase {

	protected static final Path SCRIPTS = Paths.get("test", "scripts");

	protected static String readScript(String name) throws IOException {
		try (InputStream is = new FileInputStream(SCRIPTS.resolve(name).toFile())) {
			return IOUtils.toString(is, StandardCharsets.UTF_8);
		}
	}

	protected static ClassDeclaration parseChecked(String source) {
		ClassDeclaration root = ScriptReader.parse(source);
		assertEquals(source, root.toOriginalString());
		return root;
	}

	protected static ClassMember member(ClassDeclaration root, int index) {
		return root.getMembers().getItems().get(index);
	}

	/**
	 * Reads the lines as the body of a function and returns its statements' owner.
	 */
	protected static MethodDeclaration parseBody(String... lines) {
		StringBuilder source = new StringBuilder("func f():\n");
		for (String line : lines) {
			source.append('\t').append(line).append('\n');
		}
		return (MethodDeclaration) member(parseChecked(source.toString()), 0);
	}

	protected static Statement statement(MethodDeclaration method, int index) {
		return method.getStatements().getItems().get(index);
	}

	protected static Expression parseExpression(String expression) {
		return ((ExpressionStatement) statement(parseBody(expression), 0)).getExpression();
	}
}
