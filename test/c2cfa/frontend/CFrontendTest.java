package c2cfa.frontend;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.Arrays;

import org.junit.Test;

import c2cfa.model.cfa.Program;
import c2cfa.trans.passes.cfa.UnsupportedFeatureIssue;
import c2cfa.trans.passes.parse.ParsingIssue;
import c2cfa.trans.passes.preprocess.ExternalCPreprocessor;
import c2cfa.trans.passes.preprocess.PassThroughPreprocessor;
import c2cfa.trans.passes.preprocess.PreprocessingIssue;

public class CFrontendTest {

	private static TranslationResult translate(String source) {
		return new CFrontend(new PassThroughPreprocessor(), false).translate(Paths.get("prog.c"), source);
	}

	@Test
	public void testProgramName() {
		assertThat(CFrontend.programName(Paths.get("dir", "prog.c")), is("prog"));
		assertThat(CFrontend.programName(Paths.get("Makefile")), is("Makefile"));
		assertThat(CFrontend.programName(Paths.get(".hidden")), is(".hidden"));
	}

	@Test
	public void testDirectivesReachTheProgram() {
		Program program = translate("// #incorrect\n// #feedback Check the bounds.\nint main() {\n  return 0;\n}\n")
				.getProgram();
		assertThat(program.isIncorrect(), is(true));
		assertThat(program.getFeedback(), is("Check the bounds."));
	}

	@Test
	public void testIncludesAreStripped() {
		TranslationResult result = translate("#include <stdio.h>\nint main() {\n  printf(\"hi\");\n}\n");
		assertThat(result.isSuccess(), is(true));
		assertThat(result.getProgram().getLineMap().lookup(3), is("main."));
	}

	@Test
	public void testParsingFailure() {
		TranslationResult result = translate("int main() {\n  return 0\n}\n");
		assertThat(result.isSuccess(), is(false));
		assertThat(result.getIssue(), instanceOf(ParsingIssue.class));
		assertThat(((ParsingIssue) result.getIssue()).getError().getLocation().getLine(), is(3));
	}

	@Test
	public void testUnsupportedConstruct() {
		TranslationResult result = translate("int main() {\n  int *p;\n}\n");
		assertThat(result.getIssue(), instanceOf(UnsupportedFeatureIssue.class));
		assertThat(((UnsupportedFeatureIssue) result.getIssue()).getLine(), is(2));
	}

	@Test
	public void testPreprocessorFailure() {
		CFrontend frontend = new CFrontend(new ExternalCPreprocessor(Arrays.asList("sh", "-c", "exit 1")), false);
		TranslationResult result = frontend.translate(Paths.get("prog.c"), "int x;");
		assertThat(result.getIssue(), instanceOf(PreprocessingIssue.class));
	}

	@Test
	public void testPreprocessorLineMarkers() {
		// stands in for cpp: prepends a line marker naming the original file
		CFrontend frontend = new CFrontend(new ExternalCPreprocessor(Arrays.asList("sh", "-c",
				"echo '# 1 \"prog.c\"'; cat")), false);
		TranslationResult result = frontend.translate(Paths.get("prog.c"), "int main() {\n  goto out;\n}\n");
		assertThat(((UnsupportedFeatureIssue) result.getIssue()).getLine(), is(2));
	}

	@Test(expected = IllegalStateException.class)
	public void testNoProgramOnFailure() {
		translate("int main(").getProgram();
	}

}
