package gdreader.syntax;

import gdreader.InvalidReadingStateError;
import gdreader.ScriptReader;
import gdreader.syntax.declarations.CustomAttribute;
import gdreader.syntax.expressions.DualOperatorExpression;
import gdreader.syntax.expressions.IdentifierExpression;
import gdreader.syntax.lists.ExpressionsList;
import gdreader.syntax.tokens.DualOperator;
import gdreader.syntax.tokens.DualOperatorType;
import gdreader.syntax.tokens.Identifier;
import gdreader.syntax.tokens.Space;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class TokensFormTest {

	private static IdentifierExpression id(String name) {
		return new IdentifierExpression(new Identifier(name));
	}

	@Test
	public void testReceiveAdvancesState() {
		DualOperatorExpression e = new DualOperatorExpression();
		TokensForm<DualOperatorExpression.State> form = e.getForm();
		assertThat(form.getState(), is(DualOperatorExpression.State.LEFT));
		form.receive(DualOperatorExpression.LEFT, id("a"));
		assertThat(form.getState(), is(DualOperatorExpression.State.OPERATOR));
		form.receive(DualOperatorExpression.OPERATOR, new DualOperator(DualOperatorType.ADD));
		form.receive(DualOperatorExpression.RIGHT, id("b"));
		assertTrue(form.isCompleted());
		assertThat(e.toOriginalString(), is("a+b"));
		assertThat(e.getLeft().getParent(), is((Node) e));
	}

	@Test(expected = InvalidReadingStateError.class)
	public void testSlotCannotBeFilledTwice() {
		DualOperatorExpression e = new DualOperatorExpression();
		e.getForm().receive(DualOperatorExpression.LEFT, id("a"));
		e.getForm().receive(DualOperatorExpression.LEFT, id("b"));
	}

	@Test(expected = InvalidReadingStateError.class)
	public void testSkipIsGuardedToo() {
		DualOperatorExpression e = new DualOperatorExpression();
		e.getForm().receive(DualOperatorExpression.RIGHT, id("b"));
		e.getForm().skip(DualOperatorExpression.OPERATOR);
	}

	// incidental tokens are kept before the slot that was expected when they arrived
	@Test
	public void testIncidentalOrdering() {
		DualOperatorExpression e = new DualOperatorExpression();
		TokensForm<DualOperatorExpression.State> form = e.getForm();
		form.receive(DualOperatorExpression.LEFT, id("a"));
		form.addBeforeActive(new Space(" "));
		form.receive(DualOperatorExpression.OPERATOR, new DualOperator(DualOperatorType.MULTIPLY));
		form.addBeforeActive(new Space("  "));
		form.skip(DualOperatorExpression.RIGHT);
		assertThat(e.toOriginalString(), is("a *  "));
		assertThat(e.getRight(), is(nullValue()));
		assertThat(form.size(), is(4));
	}

	@Test
	public void testSetReplacesAndDetaches() {
		DualOperatorExpression e = new DualOperatorExpression();
		IdentifierExpression a = id("a");
		e.setLeft(a);
		IdentifierExpression b = id("b");
		e.setLeft(b);
		assertThat(a.getParent(), is(nullValue()));
		assertThat(e.toOriginalString(), is("b"));
		assertTrue(b.removeFromParent());
		assertFalse(b.removeFromParent());
		assertThat(e.toOriginalString(), is(""));
	}

	@Test
	public void testSlotsIterateInOrder() {
		DualOperatorExpression e = new DualOperatorExpression();
		e.setRight(id("c"));
		e.setLeft(id("a"));
		e.setOperator(new DualOperator(DualOperatorType.SUBTRACT));
		assertThat(e.toOriginalString(), is("a-c"));
		assertThat(e.getFirstToken().toOriginalString(), is("a"));
		assertThat(e.getLastToken().toOriginalString(), is("c"));
	}

	// filling a later slot passes over the optional one before it
	@Test
	public void testSkippedSlotStaysAbsent() {
		DualOperatorExpression e = new DualOperatorExpression();
		TokensForm<DualOperatorExpression.State> form = e.getForm();
		form.receive(DualOperatorExpression.LEFT, id("a"));
		form.skip(DualOperatorExpression.OPERATOR);
		assertThat(form.getState(), is(DualOperatorExpression.State.RIGHT));
		form.receive(DualOperatorExpression.RIGHT, id("c"));
		assertThat(e.getOperator(), is(nullValue()));
		assertThat(e.getRight().getParent(), is((Node) e));
		assertThat(e.toOriginalString(), is("ac"));
	}

	// an absent list is created on first access; an explicit null is kept
	@Test
	public void testGetOrCreate() {
		CustomAttribute tool = (CustomAttribute) ScriptReader.parse("@tool\n").getMembers().getItems().get(0);
		assertThat(tool.getOpenBracket(), is(nullValue()));
		ExpressionsList parameters = tool.getParameters();
		assertThat(parameters.getItems().size(), is(0));
		assertThat(parameters.toOriginalString(), is(""));
		assertThat(parameters.getParent(), is((Node) tool));
		assertThat(tool.getParameters(), is(parameters));
		assertThat(tool.toOriginalString(), is("@tool"));

		tool.getForm().set(CustomAttribute.PARAMETERS, null);
		assertThat(tool.getParameters(), is(nullValue()));
		assertThat(parameters.getParent(), is(nullValue()));
		assertThat(tool.toOriginalString(), is("@tool"));
	}
}
