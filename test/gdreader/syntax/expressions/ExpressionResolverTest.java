package gdreader.syntax.expressions;

import gdreader.ReaderTestBase;
import gdreader.syntax.Node;
import gdreader.syntax.SyntaxToken;
import gdreader.syntax.TreeIterables;
import gdreader.syntax.declarations.MethodDeclaration;
import gdreader.syntax.statements.ExpressionStatement;
import gdreader.syntax.statements.VariableDeclarationStatement;
import gdreader.syntax.tokens.Comment;
import gdreader.syntax.tokens.DualOperatorType;
import gdreader.syntax.tokens.SingleOperatorType;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class ExpressionResolverTest extends ReaderTestBase {

	private static DualOperatorExpression dual(Expression e, DualOperatorType type) {
		assertThat(e, instanceOf(DualOperatorExpression.class));
		DualOperatorExpression d = (DualOperatorExpression) e;
		assertThat(d.getOperatorType(), is(type));
		return d;
	}

	private static String name(Expression e) {
		assertThat(e, instanceOf(IdentifierExpression.class));
		return ((IdentifierExpression) e).getIdentifier().getSequence();
	}

	@Test
	public void testHigherPriorityBindsTighter() {
		DualOperatorExpression add = dual(parseExpression("a + b * c"), DualOperatorType.ADD);
		assertThat(name(add.getLeft()), is("a"));
		DualOperatorExpression mul = dual(add.getRight(), DualOperatorType.MULTIPLY);
		assertThat(name(mul.getLeft()), is("b"));
		assertThat(name(mul.getRight()), is("c"));
	}

	@Test
	public void testLowerPriorityTakesWholeLeftSide() {
		DualOperatorExpression add = dual(parseExpression("a * b + c"), DualOperatorType.ADD);
		dual(add.getLeft(), DualOperatorType.MULTIPLY);
		assertThat(name(add.getRight()), is("c"));
	}

	@Test
	public void testLeftAssociative() {
		DualOperatorExpression outer = dual(parseExpression("a - b - c"), DualOperatorType.SUBTRACT);
		DualOperatorExpression inner = dual(outer.getLeft(), DualOperatorType.SUBTRACT);
		assertThat(name(inner.getLeft()), is("a"));
		assertThat(name(outer.getRight()), is("c"));
	}

	@Test
	public void testAssignmentIsRightAssociative() {
		DualOperatorExpression outer = dual(parseExpression("a = b = c"), DualOperatorType.ASSIGNMENT);
		assertThat(name(outer.getLeft()), is("a"));
		DualOperatorExpression inner = dual(outer.getRight(), DualOperatorType.ASSIGNMENT);
		assertThat(name(inner.getLeft()), is("b"));
	}

	@Test
	public void testLongestOperatorMatch() {
		DualOperatorExpression e = dual(parseExpression("x **= 2"), DualOperatorType.POWER_AND_ASSIGN);
		assertThat(e.getOperator().getSequence(), is("**="));
		dual(parseExpression("x ** 2"), DualOperatorType.POWER);
		dual(parseExpression("x <= 2"), DualOperatorType.LESS_OR_EQUAL);
		dual(parseExpression("x << 2"), DualOperatorType.BIT_SHIFT_LEFT);
	}

	@Test
	public void testWordOperators() {
		DualOperatorExpression or = dual(parseExpression("a and b or c"), DualOperatorType.OR);
		dual(or.getLeft(), DualOperatorType.AND);
		dual(parseExpression("a is Node"), DualOperatorType.IS);
		dual(parseExpression("a in b"), DualOperatorType.IN);
	}

	@Test
	public void testPrefixOperators() {
		DualOperatorExpression mul = dual(parseExpression("-a * b"), DualOperatorType.MULTIPLY);
		SingleOperatorExpression neg = (SingleOperatorExpression) mul.getLeft();
		assertThat(neg.getOperator().getOperatorType(), is(SingleOperatorType.NEGATE));

		SingleOperatorExpression not = (SingleOperatorExpression) parseExpression("not a == b");
		assertThat(not.getOperator().getOperatorType(), is(SingleOperatorType.NOT_WORD));
		dual(not.getTarget(), DualOperatorType.EQUAL);
	}

	// a prefix operator on the right keeps everything that binds tighter than itself
	@Test
	public void testPrefixOperatorOnRightSide() {
		DualOperatorExpression assign = dual(parseExpression("x = -a ** 2 + not b == c"), DualOperatorType.ASSIGNMENT);
		assertThat(name(assign.getLeft()), is("x"));
		DualOperatorExpression add = dual(assign.getRight(), DualOperatorType.ADD);
		SingleOperatorExpression neg = (SingleOperatorExpression) add.getLeft();
		assertThat(neg.getOperator().getOperatorType(), is(SingleOperatorType.NEGATE));
		dual(neg.getTarget(), DualOperatorType.POWER);
		SingleOperatorExpression not = (SingleOperatorExpression) add.getRight();
		assertThat(not.getOperator().getOperatorType(), is(SingleOperatorType.NOT_WORD));
		DualOperatorExpression equal = dual(not.getTarget(), DualOperatorType.EQUAL);
		assertThat(name(equal.getLeft()), is("b"));
		assertThat(name(equal.getRight()), is("c"));

		DualOperatorExpression minus = dual(parseExpression("a - not b - c"), DualOperatorType.SUBTRACT);
		assertThat(name(minus.getLeft()), is("a"));
		dual(((SingleOperatorExpression) minus.getRight()).getTarget(), DualOperatorType.SUBTRACT);
	}

	@Test
	public void testNegatedWordOperators() {
		DualOperatorExpression notIn = dual(parseExpression("a not in b"), DualOperatorType.NOT_IN);
		assertThat(notIn.getOperator().getSequence(), is("not in"));
		assertThat(name(notIn.getRight()), is("b"));

		DualOperatorExpression isNot = dual(parseExpression("a is not B"), DualOperatorType.IS_NOT);
		assertThat(name(isNot.getLeft()), is("a"));
		assertThat(name(isNot.getRight()), is("B"));

		// a name starting with "not" is not the negation
		DualOperatorExpression is = dual(parseExpression("a is nothing"), DualOperatorType.IS);
		assertThat(name(is.getRight()), is("nothing"));

		DualOperatorExpression and = dual(parseExpression("x is not Node and y not in z"), DualOperatorType.AND);
		dual(and.getLeft(), DualOperatorType.IS_NOT);
		dual(and.getRight(), DualOperatorType.NOT_IN);
	}

	@Test
	public void testAwait() {
		SingleOperatorExpression await = (SingleOperatorExpression) parseExpression("await get_tree().process_frame");
		assertThat(await.getOperator().getOperatorType(), is(SingleOperatorType.AWAIT));
		assertThat(await.getTarget(), instanceOf(MemberOperatorExpression.class));

		DualOperatorExpression add = dual(parseExpression("await a + b"), DualOperatorType.ADD);
		assertThat(add.getLeft(), instanceOf(SingleOperatorExpression.class));
	}

	@Test
	public void testPrefixedStrings() {
		StringExpression name = (StringExpression) parseExpression("&\"jump\"");
		assertTrue(name.isStringName());
		assertThat(name.getRawValue(), is("jump"));
		assertTrue(name.isTerminated());

		StringExpression path = (StringExpression) parseExpression("^\"../Camera\"");
		assertTrue(path.isNodePath());
		assertThat(path.getRawValue(), is("../Camera"));

		StringExpression plain = (StringExpression) parseExpression("\"x\"");
		assertThat(plain.getPrefix(), is(nullValue()));

		DualOperatorExpression xor = dual(parseExpression("a ^ b"), DualOperatorType.XOR);
		assertThat(name(xor.getRight()), is("b"));
	}

	@Test
	public void testGetNode() {
		MemberOperatorExpression member = (MemberOperatorExpression) parseExpression("$Body/Sprite.position");
		GetNodeExpression body = (GetNodeExpression) member.getCaller();
		assertThat(body.getPathText(), is("Body/Sprite"));
		assertThat(body.isUniqueName(), is(false));
		assertThat(member.getIdentifier().getSequence(), is("position"));

		GetNodeExpression quoted = (GetNodeExpression) parseExpression("$\"../Other\"");
		assertThat(quoted.getPath(), is(nullValue()));
		assertThat(quoted.getPathText(), is("../Other"));

		GetNodeExpression unique = (GetNodeExpression) parseExpression("%ScoreLabel");
		assertTrue(unique.isUniqueName());
		assertThat(unique.getPathText(), is("ScoreLabel"));

		DualOperatorExpression mod = dual(parseExpression("a % b"), DualOperatorType.MOD);
		assertThat(name(mod.getRight()), is("b"));
	}

	@Test
	public void testInlineLambda() {
		DualOperatorExpression assign = dual(parseExpression("f = func(x): return x * 2"), DualOperatorType.ASSIGNMENT);
		LambdaExpression lambda = (LambdaExpression) assign.getRight();
		assertThat(lambda.getIdentifier(), is(nullValue()));
		assertThat(lambda.getParameters().getItems().size(), is(1));
		assertThat(lambda.getStatements().getItems().size(), is(1));
		assertTrue(lambda.getStatements().isInline());
		ReturnExpression ret = (ReturnExpression) ((ExpressionStatement) lambda.getStatements().getItems().get(0)).getExpression();
		dual(ret.getResult(), DualOperatorType.MULTIPLY);
	}

	// the bracket of the call ends the body of a lambda passed to it
	@Test
	public void testLambdaAsArgument() {
		CallExpression call = (CallExpression) parseExpression("button.connect(func(): pressed = true, 1)");
		assertThat(call.getParameters().getItems().size(), is(2));
		LambdaExpression lambda = (LambdaExpression) call.getParameters().getItems().get(0);
		assertThat(lambda.getStatements().getItems().size(), is(1));
		assertThat(lambda.toOriginalString(), is("func(): pressed = true"));
		assertThat(call.getParameters().getItems().get(1), instanceOf(NumberExpression.class));
	}

	@Test
	public void testLambdaBlock() {
		MethodDeclaration method = parseBody("var twice = func named(x: int) -> int:", "\tvar y = x", "\treturn y * 2", "print(twice.call(1))");
		assertThat(method.getStatements().getItems().size(), is(2));
		VariableDeclarationStatement declaration = (VariableDeclarationStatement) statement(method, 0);
		LambdaExpression lambda = (LambdaExpression) declaration.getDeclaration().getInitializer();
		assertThat(lambda.getIdentifier().getSequence(), is("named"));
		assertThat(lambda.getReturnType().getName().getSequence(), is("int"));
		assertThat(lambda.getIntendation(), is(1));
		assertFalse(lambda.getStatements().isInline());
		assertThat(lambda.getStatements().getItems().size(), is(2));
		assertThat(statement(method, 1), instanceOf(ExpressionStatement.class));
	}

	@Test
	public void testPostfixChain() {
		IndexerExpression indexer = (IndexerExpression) parseExpression("a.b(c)[0]");
		CallExpression call = (CallExpression) indexer.getCaller();
		MemberOperatorExpression member = (MemberOperatorExpression) call.getCaller();
		assertThat(name(member.getCaller()), is("a"));
		assertThat(member.getIdentifier().getSequence(), is("b"));
		assertThat(call.getParameters().getItems().size(), is(1));
		assertThat(indexer.getInner(), instanceOf(NumberExpression.class));
	}

	@Test
	public void testPostfixBindsTighterThanOperators() {
		DualOperatorExpression add = dual(parseExpression("a + b.c"), DualOperatorType.ADD);
		assertThat(add.getRight(), instanceOf(MemberOperatorExpression.class));
	}

	@Test
	public void testConditional() {
		IfExpression e = (IfExpression) parseExpression("a if c else b");
		assertThat(name(e.getTrueExpression()), is("a"));
		assertThat(name(e.getCondition()), is("c"));
		assertThat(name(e.getFalseExpression()), is("b"));
	}

	@Test
	public void testConditionalBindsLooserThanOr() {
		IfExpression e = (IfExpression) parseExpression("a or b if c else d");
		dual(e.getTrueExpression(), DualOperatorType.OR);
	}

	@Test
	public void testBrackets() {
		DualOperatorExpression mul = dual(parseExpression("(a + b) * c"), DualOperatorType.MULTIPLY);
		BracketExpression bracket = (BracketExpression) mul.getLeft();
		dual(bracket.getInner(), DualOperatorType.ADD);
	}

	@Test
	public void testLiterals() {
		assertThat(((BoolExpression) parseExpression("true")).getValue(), is(true));
		assertThat(parseExpression("null"), instanceOf(KeywordExpression.class));
		assertThat(parseExpression("self"), instanceOf(KeywordExpression.class));
		assertThat(((StringExpression) parseExpression("'a\\'b'")).getRawValue(), is("a\\'b"));
		assertThat(((StringExpression) parseExpression("\"\"")).getRawValue(), is(""));
		StringExpression triple = (StringExpression) parseExpression("\"\"\"x\n\"y\" \"\"\"");
		assertTrue(triple.isTriple());
		assertThat(triple.getRawValue(), is("x\n\"y\" "));
	}

	@Test
	public void testArrayAndDictionary() {
		ArrayInitializerExpression array = (ArrayInitializerExpression) parseExpression("[1, [2], \"3\"]");
		assertThat(array.getValues().getItems().size(), is(3));
		DictionaryInitializerExpression dict = (DictionaryInitializerExpression) parseExpression("{\"a\": 1, b = 2}");
		assertThat(dict.getValues().getItems().size(), is(2));
		DictionaryKeyValue second = dict.getValues().getItems().get(1);
		assertThat(name(second.getKey()), is("b"));
		assertThat(second.getValue(), instanceOf(NumberExpression.class));
	}

	@Test
	public void testMultiLineBrackets() {
		ArrayInitializerExpression array = (ArrayInitializerExpression) parseExpression("[1,\n\t\t2, # two\n\t\t3]");
		assertThat(array.getValues().getItems().size(), is(3));
	}

	@Test
	public void testLineContinuation() {
		dual(parseExpression("a + \\\n\t\tb"), DualOperatorType.ADD);
	}

	@Test
	public void testReturn() {
		ReturnExpression ret = (ReturnExpression) parseExpression("return a + 1");
		dual(ret.getResult(), DualOperatorType.ADD);
		assertThat(((ReturnExpression) parseExpression("return")).getResult(), is(nullValue()));
	}

	// spaces before a trailing comment stay outside the expression
	@Test
	public void testTrailingCommentAfterSpaces() {
		MethodDeclaration method = parseBody("x  #comment");
		ExpressionStatement statement = (ExpressionStatement) statement(method, 0);
		Expression x = statement.getExpression();
		assertThat(x.toOriginalString(), is("x"));
		int comments = 0;
		for (SyntaxToken token : TreeIterables.descendants(method)) {
			if (token instanceof Comment) {
				comments++;
				assertThat(token.toOriginalString(), is("#comment"));
				assertThat(token.getStartColumn(), is(4));
			}
		}
		assertThat(comments, is(1));
	}

	@Test
	public void testChildrenKnowTheirParent() {
		Expression root = parseExpression("a + b * c");
		for (SyntaxToken token : TreeIterables.descendants((Node) root)) {
			assertTrue(token.getParent() != null);
			assertTrue(token.getStartOffset() >= token.getParent().getStartOffset());
		}
	}
}
