package gdreader;

import gdreader.syntax.declarations.ClassDeclaration;
import gdreader.syntax.declarations.MethodDeclaration;
import org.junit.Test;

import java.nio.file.Paths;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class ReaderSettingsTest {

	@Test
	public void testDefaults() {
		assertThat(new ReaderSettings().getTabSize(), is(ReaderSettings.DEFAULT_TAB_SIZE));
		assertThat(ReaderSettings.fromJson("{}").getTabSize(), is(ReaderSettings.DEFAULT_TAB_SIZE));
		assertThat(ReaderSettings.fromJson("{\"reader\": {}}").getTabSize(), is(ReaderSettings.DEFAULT_TAB_SIZE));
	}

	@Test
	public void testTabSize() {
		assertThat(ReaderSettings.fromJson("{\"reader\": {\"tab_size\": 8}, \"other\": 1}").getTabSize(), is(8));
	}

	@Test(expected = ReaderSettingsException.class)
	public void testMalformedJson() {
		ReaderSettings.fromJson("{reader");
	}

	@Test(expected = ReaderSettingsException.class)
	public void testWrongType() {
		ReaderSettings.fromJson("{\"reader\": {\"tab_size\": \"wide\"}}");
	}

	@Test(expected = ReaderSettingsException.class)
	public void testNonPositiveTabSize() {
		ReaderSettings.fromJson("{\"reader\": {\"tab_size\": 0}}");
	}

	@Test(expected = ReaderSettingsException.class)
	public void testMissingFile() {
		ReaderSettings.fromFile(Paths.get("test", "scripts", "missing.json"));
	}

	// with a tab of two columns, a tab and two spaces indent the same
	@Test
	public void testTabSizeAffectsBlocks() {
		String source = "func f():\n\ta()\n  b()\n";
		ClassDeclaration narrow = ScriptReader.parse(source, new ReaderSettings(2));
		assertThat(((MethodDeclaration) narrow.getMembers().getItems().get(0)).getStatements().getItems().size(), is(2));
		ClassDeclaration wide = ScriptReader.parse(source, new ReaderSettings(4));
		assertThat(((MethodDeclaration) wide.getMembers().getItems().get(0)).getStatements().getItems().size(), is(1));
		assertThat(wide.toOriginalString(), is(source));
	}
}
