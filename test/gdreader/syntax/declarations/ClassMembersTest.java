package gdreader.syntax.declarations;

import gdreader.ReaderTestBase;
import gdreader.syntax.expressions.ArrayInitializerExpression;
import gdreader.syntax.expressions.DualOperatorExpression;
import gdreader.syntax.expressions.IdentifierExpression;
import gdreader.syntax.expressions.NumberExpression;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.List;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class ClassMembersTest extends ReaderTestBase {

	private List<ClassMember> members;

	@Before
	public void setup() throws IOException {
		members = parseChecked(readScript("player.gd")).getMembers().getItems();
	}

	@Test
	public void testMemberKinds() {
		Class<?>[] expected = {
				ToolAttribute.class,
				ExtendsAttribute.class,
				ClassNameAttribute.class,
				SignalDeclaration.class,
				SignalDeclaration.class,
				EnumDeclaration.class,
				VariableDeclaration.class,
				VariableDeclaration.class,
				VariableDeclaration.class,
				VariableDeclaration.class,
				VariableDeclaration.class,
				VariableDeclaration.class,
				CustomAttribute.class,
				VariableDeclaration.class,
				MethodDeclaration.class,
				MethodDeclaration.class,
				MethodDeclaration.class,
		};
		assertThat(members.size(), is(expected.length));
		for (int i = 0; i < expected.length; i++) {
			assertThat(members.get(i), instanceOf(expected[i]));
		}
	}

	@Test
	public void testAttributes() {
		ExtendsAttribute extendsAttribute = (ExtendsAttribute) members.get(1);
		assertThat(((IdentifierExpression) extendsAttribute.getPath()).getIdentifier().getSequence(), is("KinematicBody2D"));
		assertThat(((ClassNameAttribute) members.get(2)).getName().getSequence(), is("Player"));

		CustomAttribute export = (CustomAttribute) members.get(12);
		assertThat(export.getName().getSequence(), is("export"));
		assertThat(export.getParameters().getItems().size(), is(3));
		assertThat(export.toOriginalString(), is("@export(int, 1, 10)"));
	}

	@Test
	public void testSignals() {
		SignalDeclaration changed = (SignalDeclaration) members.get(3);
		assertThat(changed.getIdentifier().getSequence(), is("health_changed"));
		assertThat(changed.getParameters().getItems().size(), is(2));
		SignalDeclaration died = (SignalDeclaration) members.get(4);
		assertThat(died.getIdentifier().getSequence(), is("died"));
		assertThat(died.getParameters().getItems().size(), is(0));
	}

	@Test
	public void testEnum() {
		EnumDeclaration state = (EnumDeclaration) members.get(5);
		assertThat(state.getIdentifier().getSequence(), is("State"));
		List<EnumValue> values = state.getValues().getItems();
		assertThat(values.size(), is(3));
		assertThat(values.get(1).getIdentifier().getSequence(), is("RUNNING"));
		assertThat(values.get(1).getValue(), instanceOf(NumberExpression.class));
		assertThat(values.get(2).getValue(), is(nullValue()));
	}

	@Test
	public void testVariables() {
		VariableDeclaration maxSpeed = (VariableDeclaration) members.get(6);
		assertTrue(maxSpeed.isConstant());
		assertThat(maxSpeed.getIdentifier().getSequence(), is("MAX_SPEED"));

		VariableDeclaration gravity = (VariableDeclaration) members.get(7);
		assertThat(gravity.getType().getName().getSequence(), is("float"));
		assertThat(gravity.getInitializer(), instanceOf(DualOperatorExpression.class));

		VariableDeclaration velocity = (VariableDeclaration) members.get(9);
		assertFalse(velocity.isConstant());
		assertThat(velocity.getType(), is(nullValue()));
		assertThat(velocity.getInitializer().toOriginalString(), is("Vector2()"));

		VariableDeclaration inventory = (VariableDeclaration) members.get(10);
		ArrayInitializerExpression array = (ArrayInitializerExpression) inventory.getInitializer();
		assertThat(array.getValues().getItems().size(), is(5));
	}

	@Test
	public void testMethods() {
		MethodDeclaration ready = (MethodDeclaration) members.get(14);
		assertThat(ready.getIdentifier().getSequence(), is("_ready"));
		assertThat(ready.getStatements().getItems().size(), is(1));

		MethodDeclaration process = (MethodDeclaration) members.get(15);
		assertThat(process.getParameters().getItems().size(), is(1));
		ParameterDeclaration delta = process.getParameters().getItems().get(0);
		assertThat(delta.getType().getName().getSequence(), is("float"));
		assertThat(process.getReturnType().getName().getSequence(), is("void"));
		assertThat(process.getStatements().getItems().size(), is(3));

		MethodDeclaration clamp = (MethodDeclaration) members.get(16);
		assertTrue(clamp.isStatic());
		ParameterDeclaration limit = clamp.getParameters().getItems().get(1);
		assertThat(limit.getDefaultValue().toOriginalString(), is("MAX_SPEED"));
	}

	@Test
	public void testInnerClass() throws IOException {
		List<ClassMember> top = parseChecked(readScript("inner_class.gd")).getMembers().getItems();
		assertThat(top.size(), is(3));
		InnerClassDeclaration item = (InnerClassDeclaration) top.get(1);
		assertThat(item.getIdentifier().getSequence(), is("Item"));
		assertThat(item.getBaseType().getName().getSequence(), is("Reference"));
		List<ClassMember> inner = item.getMembers().getItems();
		assertThat(inner.size(), is(4));
		InnerClassDeclaration nested = (InnerClassDeclaration) inner.get(3);
		assertThat(nested.getMembers().getItems().size(), is(1));
		assertThat(top.get(2), instanceOf(MethodDeclaration.class));
	}

	@Test
	public void testTypes() {
		VariableDeclaration v = (VariableDeclaration) member(parseChecked("var a: Array[int] = []\nvar b: Foo.Bar\n"), 0);
		assertThat(v.getType().getName().getSequence(), is("Array"));
		assertThat(v.getType().getElementType().getName().getSequence(), is("int"));
		VariableDeclaration w = (VariableDeclaration) member(parseChecked("var b: Foo.Bar\n"), 0);
		assertThat(w.getType().getInner().getName().getSequence(), is("Bar"));
	}

	@Test
	public void testExportScenario() {
		CustomAttribute export = (CustomAttribute) member(parseChecked("@export(1, 2)"), 0);
		assertThat(export.getAt().toOriginalString(), is("@"));
		assertThat(export.getName().getSequence(), is("export"));
		assertThat(export.getOpenBracket().toOriginalString(), is("("));
		assertThat(export.getParameters().getItems().size(), is(2));
		assertThat(export.getParameters().getItems().get(0).toOriginalString(), is("1"));
		assertThat(export.getParameters().getItems().get(1).toOriginalString(), is("2"));
		assertThat(export.getCloseBracket().toOriginalString(), is(")"));
		assertThat(export.toOriginalString(), is("@export(1, 2)"));
	}

	// an attribute and the member it annotates may share a line
	@Test
	public void testAttributeBeforeMemberOnSameLine() {
		List<ClassMember> items = parseChecked("@onready var x = 1\n").getMembers().getItems();
		assertThat(items.size(), is(2));
		assertThat(items.get(0), instanceOf(CustomAttribute.class));
		assertThat(((VariableDeclaration) items.get(1)).getIdentifier().getSequence(), is("x"));
	}

	// the word after "static" decides the member
	@Test
	public void testStaticMembers() {
		List<ClassMember> items = parseChecked("static var count := 0\nstatic  func make():\n\tpass\nvar plain = 1\n")
				.getMembers().getItems();
		assertThat(items.size(), is(3));
		VariableDeclaration count = (VariableDeclaration) items.get(0);
		assertTrue(count.isStatic());
		assertFalse(count.isConstant());
		assertThat(count.getIdentifier().getSequence(), is("count"));
		assertThat(count.toOriginalString(), is("static var count := 0"));
		MethodDeclaration make = (MethodDeclaration) items.get(1);
		assertTrue(make.isStatic());
		assertThat(make.getIdentifier().getSequence(), is("make"));
		assertFalse(((VariableDeclaration) items.get(2)).isStatic());
	}

	@Test
	public void testPropertyAccessorBlocks() {
		String source = "var health: int = 100:\n" +
				"\tget:\n" +
				"\t\treturn health\n" +
				"\tset(value):\n" +
				"\t\thealth = value\n" +
				"var speed:\n" +
				"\tget = get_speed, set = set_speed\n" +
				"var plain = 1\n";
		List<ClassMember> items = parseChecked(source).getMembers().getItems();
		assertThat(items.size(), is(3));

		VariableDeclaration health = (VariableDeclaration) items.get(0);
		assertThat(health.getType().getName().getSequence(), is("int"));
		assertThat(health.getInitializer(), instanceOf(NumberExpression.class));
		List<PropertyAccessor> accessors = health.getAccessors().getItems();
		assertThat(accessors.size(), is(2));
		assertTrue(accessors.get(0).isGetter());
		assertThat(accessors.get(0).getStatements().getItems().size(), is(1));
		assertTrue(accessors.get(1).isSetter());
		assertThat(accessors.get(1).getParameter().getSequence(), is("value"));
		assertThat(accessors.get(1).getStatements().getItems().size(), is(1));

		VariableDeclaration speed = (VariableDeclaration) items.get(1);
		assertThat(speed.getType(), is(nullValue()));
		accessors = speed.getAccessors().getItems();
		assertThat(accessors.size(), is(2));
		assertThat(accessors.get(0).getMethod().getSequence(), is("get_speed"));
		assertThat(accessors.get(1).getMethod().getSequence(), is("set_speed"));
		assertThat(accessors.get(1).getStatements(), is(nullValue()));

		assertThat(((VariableDeclaration) items.get(2)).getAccessors(), is(nullValue()));
	}

	@Test
	public void testPropertyAccessorsOnSameLine() {
		VariableDeclaration hp = (VariableDeclaration) member(parseChecked("var hp = 10: get = get_hp, set = set_hp\n"), 0);
		assertTrue(hp.getAccessors().isInline());
		assertThat(hp.getAccessors().getItems().size(), is(2));
		assertThat(hp.getAccessors().getItems().get(0).getMethod().getSequence(), is("get_hp"));
	}
}
