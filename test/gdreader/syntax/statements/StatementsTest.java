package gdreader.syntax.statements;

import gdreader.ReaderTestBase;
import gdreader.syntax.declarations.ClassDeclaration;
import gdreader.syntax.declarations.MethodDeclaration;
import gdreader.syntax.expressions.BindingPatternExpression;
import gdreader.syntax.expressions.DualOperatorExpression;
import gdreader.syntax.expressions.Expression;
import gdreader.syntax.expressions.ReturnExpression;
import gdreader.syntax.expressions.StringExpression;
import gdreader.syntax.tokens.DualOperatorType;
import org.junit.Test;

import java.io.IOException;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class StatementsTest extends ReaderTestBase {

	@Test
	public void testIfElifElse() throws IOException {
		ClassDeclaration root = parseChecked(readScript("player.gd"));
		MethodDeclaration process = (MethodDeclaration) member(root, 15);
		IfStatement ifStatement = (IfStatement) statement(process, 1);
		assertThat(ifStatement.getIfBranch().getStatements().getItems().size(), is(1));
		assertThat(ifStatement.getElifBranches().getItems().size(), is(1));
		assertThat(ifStatement.getElseBranch().getCondition(), is(nullValue()));
		assertThat(ifStatement.getElseBranch().getStatements().getItems().size(), is(1));
		assertThat(statement(process, 2), instanceOf(ExpressionStatement.class));
	}

	@Test
	public void testIfWithoutElse() {
		MethodDeclaration method = parseBody("if a:", "\tb()", "c()");
		IfStatement ifStatement = (IfStatement) statement(method, 0);
		assertThat(ifStatement.getElifBranches().getItems().size(), is(0));
		assertThat(ifStatement.getElseBranch(), is(nullValue()));
		assertThat(method.getStatements().getItems().size(), is(2));
	}

	@Test
	public void testInlineBody() {
		MethodDeclaration method = parseBody("if a: return 1", "else: return 2");
		IfStatement ifStatement = (IfStatement) statement(method, 0);
		assertTrue(ifStatement.getIfBranch().getStatements().isInline());
		assertThat(ifStatement.getElseBranch().getStatements().getItems().size(), is(1));
		assertThat(method.getStatements().getItems().size(), is(1));
	}

	// an else indented deeper than its if belongs to a nested statement
	@Test
	public void testNestedIf() {
		MethodDeclaration method = parseBody("if a:", "\tif b:", "\t\tpass", "else:", "\tpass");
		IfStatement outer = (IfStatement) statement(method, 0);
		IfStatement inner = (IfStatement) outer.getIfBranch().getStatements().getItems().get(0);
		assertThat(inner.getElseBranch(), is(nullValue()));
		assertFalse(outer.getElseBranch() == null);
	}

	@Test
	public void testLoopsAndMatch() throws IOException {
		ClassDeclaration root = parseChecked(readScript("statements.gd"));
		MethodDeclaration loops = (MethodDeclaration) member(root, 0);
		assertThat(loops.getStatements().getItems().size(), is(5));
		assertThat(statement(loops, 0), instanceOf(VariableDeclarationStatement.class));

		ForStatement forStatement = (ForStatement) statement(loops, 1);
		assertThat(forStatement.getVariable().getSequence(), is("item"));
		assertThat(forStatement.getCollection().toOriginalString(), is("items"));
		assertThat(forStatement.getStatements().getItems().size(), is(2));

		WhileStatement whileStatement = (WhileStatement) statement(loops, 2);
		DualOperatorExpression condition = (DualOperatorExpression) whileStatement.getCondition();
		assertThat(condition.getOperatorType(), is(DualOperatorType.AND));

		MatchStatement match = (MatchStatement) statement(loops, 3);
		assertThat(match.getCases().getItems().size(), is(3));
		MatchCaseDeclaration first = match.getCases().getItems().get(0);
		assertThat(first.getConditions().getItems().size(), is(2));
		assertThat(match.getCases().getItems().get(2).getConditions().getItems().get(0).toOriginalString(), is("_"));

		ExpressionStatement last = (ExpressionStatement) statement(loops, 4);
		assertThat(last.getExpression(), instanceOf(ReturnExpression.class));
	}

	@Test
	public void testStrings() throws IOException {
		ClassDeclaration root = parseChecked(readScript("statements.gd"));
		MethodDeclaration strings = (MethodDeclaration) member(root, 1);
		VariableDeclarationStatement s = (VariableDeclarationStatement) statement(strings, 0);
		StringExpression multi = (StringExpression) s.getDeclaration().getInitializer();
		assertTrue(multi.isTriple());
		assertThat(multi.getRawValue(), is("multi\nline"));
		VariableDeclarationStatement t = (VariableDeclarationStatement) statement(strings, 1);
		assertThat(((StringExpression) t.getDeclaration().getInitializer()).getRawValue(), is("it\\'s"));
	}

	@Test
	public void testSemicolonSeparatedStatements() {
		MethodDeclaration method = parseBody("a = 1; b = 2");
		assertThat(method.getStatements().getItems().size(), is(2));
	}

	@Test
	public void testCarriageReturns() throws IOException {
		ClassDeclaration root = parseChecked(readScript("crlf.gd"));
		MethodDeclaration f = (MethodDeclaration) member(root, 1);
		assertThat(f.getStatements().getItems().size(), is(2));
		VariableDeclarationStatement c = (VariableDeclarationStatement) statement(f, 0);
		assertThat(c.getDeclaration().getInitializer(), instanceOf(DualOperatorExpression.class));
	}

	@Test
	public void testTypedForVariable() {
		MethodDeclaration method = parseBody("for i: int in range(3):", "\tprint(i)", "for j in k: pass");
		ForStatement typed = (ForStatement) statement(method, 0);
		assertThat(typed.getVariable().getSequence(), is("i"));
		assertThat(typed.getVariableType().getName().getSequence(), is("int"));
		assertThat(typed.getCollection().toOriginalString(), is("range(3)"));
		assertThat(typed.getStatements().getItems().size(), is(1));
		ForStatement plain = (ForStatement) statement(method, 1);
		assertThat(plain.getVariableType(), is(nullValue()));
		assertThat(plain.getCollection().toOriginalString(), is("k"));
	}

	@Test
	public void testMatchBindingPattern() {
		MethodDeclaration method = parseBody("match value:", "\t0:", "\t\tpass", "\tvar other:", "\t\tprint(other)");
		MatchStatement match = (MatchStatement) statement(method, 0);
		assertThat(match.getCases().getItems().size(), is(2));
		Expression pattern = match.getCases().getItems().get(1).getConditions().getItems().get(0);
		assertThat(pattern, instanceOf(BindingPatternExpression.class));
		assertThat(((BindingPatternExpression) pattern).getIdentifier().getSequence(), is("other"));
	}
}
