package c2cfa;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import c2cfa.model.cfa.Program;

public class C2CfaMainTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	// preprocessing is switched off so the tests do not depend on cpp
	private String config;

	@Before
	public void setup() throws IOException {
		File file = folder.newFile("config.json");
		FileUtils.writeStringToFile(file, "{\"preprocessor\": {\"enabled\": false}}", StandardCharsets.UTF_8);
		config = file.getPath();
	}

	private String source(String name, String text) throws IOException {
		File file = folder.newFile(name);
		FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);
		return file.getPath();
	}

	@Test
	public void testJsonOutput() throws IOException {
		String input = source("count.c", "#include <stdio.h>\nint main() {\n  int i;\n"
				+ "  for (i = 0; i < 3; i++) printf(\"%d\\n\", i);\n  return 0;\n}\n");
		File output = new File(folder.getRoot(), "count.json");
		int status = new C2CfaMain(new String[] {"-q", "-c", config, "-f", "json", "-o", output.getPath(), input})
				.run();
		assertThat(status, is(C2CfaMain.EXIT_OK));
		JSONObject json = new JSONObject(FileUtils.readFileToString(output, StandardCharsets.UTF_8));
		assertThat(json.getString("name"), is("count"));
		assertThat(json.getJSONArray("functions").getJSONObject(0).getString("name"), is("main"));
	}

	@Test
	public void testTextOutput() throws IOException {
		String input = source("one.c", "int one() {\n  return 1;\n}\n");
		File output = new File(folder.getRoot(), "one.txt");
		int status = new C2CfaMain(new String[] {"-q", "-c", config, "-o", output.getPath(), input}).run();
		assertThat(status, is(C2CfaMain.EXIT_OK));
		assertThat(FileUtils.readFileToString(output, StandardCharsets.UTF_8), startsWith("program one"));
	}

	@Test
	public void testUnsupportedProgram() throws IOException {
		String input = source("ptr.c", "int main() {\n  int *p;\n}\n");
		assertThat(new C2CfaMain(new String[] {"-q", "-c", config, input}).run(),
				is(C2CfaMain.EXIT_TRANSLATION_FAILED));
	}

	@Test
	public void testMissingSource() {
		String input = new File(folder.getRoot(), "absent.c").getPath();
		assertThat(new C2CfaMain(new String[] {"-q", "-c", config, input}).run(),
				is(C2CfaMain.EXIT_TRANSLATION_FAILED));
	}

	@Test
	public void testUnknownLanguage() throws IOException {
		String input = source("prog.py", "print(1)\n");
		assertThat(new C2CfaMain(new String[] {"-q", "-l", "python", input}).run(),
				is(C2CfaMain.EXIT_BAD_OPTIONS));
	}

	@Test
	public void testBadOptions() {
		assertThat(new C2CfaMain(new String[] {"-q", "-f", "yaml", "x.c"}).run(), is(C2CfaMain.EXIT_BAD_OPTIONS));
	}

	@Test
	public void testUnknownFlag() {
		assertThat(new C2CfaMain(new String[] {"-q", "--frobnicate", "x.c"}).run(), is(C2CfaMain.EXIT_BAD_OPTIONS));
	}

	@Test
	public void testHelp() {
		assertThat(new C2CfaMain(new String[] {"-h"}).run(), is(C2CfaMain.EXIT_OK));
	}

	@Test
	public void testWriteProgramAsText() throws IOException {
		StringWriter w = new StringWriter();
		C2CfaMain.writeProgram(C2CfaOptions.FORMAT_TEXT, new Program("empty"), w);
		assertThat(w.toString(), startsWith("program empty"));
	}

}
