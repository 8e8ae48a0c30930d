package c2cfa.trans.passes.preprocess;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class PreprocessingPassTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{"int x;\n", "int x;\n"},
			{"#include <stdio.h>\nint main() {}\n", "\nint main() {}\n"},
			{"  #  include \"lib.h\"\r\n#define N 3\n", "\r\n#define N 3\n"},
			{"int x; // #include <stdio.h>\n", "int x; // #include <stdio.h>\n"},
			{"#include <a.h>\n#include <b.h>", "\n"},
			{"#includes\n", "#includes\n"},
		});
	}

	private String source;
	private String expected;

	public PreprocessingPassTest(String source, String expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void testStripIncludes() {
		assertThat(PreprocessingPass.stripIncludes(source), is(expected));
	}

	@Test
	public void testPassThrough() {
		assertThat(PreprocessingPass.perform(new PassThroughPreprocessor(), Paths.get("x.c"), source), is(expected));
	}

}
