package aldafmt;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class FormattingOptionsTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	// configuration document used in the tests
	private JSONObject config;

	@Before
	public void setup() {
		config = new JSONObject();
		config.put(FormattingOptions.SOFT_WRAP_FIELD, 100);
		config.put(FormattingOptions.INDENT_TEXT_FIELD, "\t");
	}

	@Test
	public void testDefaults() {
		FormattingOptions options = FormattingOptions.defaults();
		assertEquals(80, options.getSoftWrap());
		assertEquals("    ", options.getIndentText());
	}

	@Test
	public void testFromJSON() throws FormattingOptionException {
		FormattingOptions options = FormattingOptions.fromJSON(config);
		assertEquals(100, options.getSoftWrap());
		assertEquals("\t", options.getIndentText());
	}

	// fields left out of the configuration keep their defaults
	@Test
	public void testMissingFieldsUseDefaults() throws FormattingOptionException {
		config.remove(FormattingOptions.INDENT_TEXT_FIELD);
		FormattingOptions options = FormattingOptions.fromJSON(config);
		assertEquals(100, options.getSoftWrap());
		assertEquals(FormattingOptions.DEFAULT_INDENT_TEXT, options.getIndentText());
		assertThat(FormattingOptions.fromJSON(new JSONObject()), is(FormattingOptions.defaults()));
	}

	@Test(expected = FormattingOptionException.class)
	public void testNonPositiveSoftWrap() throws FormattingOptionException {
		config.put(FormattingOptions.SOFT_WRAP_FIELD, 0);
		FormattingOptions.fromJSON(config);
	}

	@Test(expected = FormattingOptionException.class)
	public void testSoftWrapNotANumber() throws FormattingOptionException {
		config.put(FormattingOptions.SOFT_WRAP_FIELD, "wide");
		FormattingOptions.fromJSON(config);
	}

	@Test(expected = FormattingOptionException.class)
	public void testSoftWrapIsAString() throws FormattingOptionException {
		config.put(FormattingOptions.SOFT_WRAP_FIELD, "12");
		FormattingOptions.fromJSON(config);
	}

	@Test(expected = FormattingOptionException.class)
	public void testSoftWrapIsFractional() throws FormattingOptionException {
		config.put(FormattingOptions.SOFT_WRAP_FIELD, 40.9);
		FormattingOptions.fromJSON(config);
	}

	@Test(expected = FormattingOptionException.class)
	public void testSoftWrapTooLarge() throws FormattingOptionException {
		FormattingOptions.fromJSON("{ \"softWrap\": 5000000000 }");
	}

	@Test
	public void testSoftWrapParsedFromText() throws FormattingOptionException {
		assertEquals(12, FormattingOptions.fromJSON("{ \"softWrap\": 12 }").getSoftWrap());
	}

	@Test(expected = FormattingOptionException.class)
	public void testIndentTextNotAString() throws FormattingOptionException {
		config.put(FormattingOptions.INDENT_TEXT_FIELD, 4);
		FormattingOptions.fromJSON(config);
	}

	@Test(expected = FormattingOptionException.class)
	public void testMalformedJSON() throws FormattingOptionException {
		FormattingOptions.fromJSON("{ \"softWrap\": ");
	}

	@Test
	public void testLoad() throws IOException, FormattingOptionException {
		File configFile = folder.newFile("aldafmt.json");
		FileUtils.writeStringToFile(configFile, config.toString(), StandardCharsets.UTF_8);
		assertThat(FormattingOptions.load(configFile.toPath()),
				is(FormattingOptions.defaults().withSoftWrap(100).withIndentText("\t")));
	}

	@Test(expected = FormattingOptionException.class)
	public void testLoadMissingFile() throws FormattingOptionException {
		FormattingOptions.load(new File(folder.getRoot(), "missing.json").toPath());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testWithNonPositiveSoftWrap() {
		FormattingOptions.defaults().withSoftWrap(-1);
	}
}
