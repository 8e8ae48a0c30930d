package c2cfa.formatters;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import c2cfa.errors.IssueContext;
import c2cfa.errors.TopLevelIssueContext;
import c2cfa.frontend.UnknownLanguageIssue;
import c2cfa.frontend.WhileTranslatingFile;
import c2cfa.trans.passes.cfa.UnsupportedFeatureIssue;
import c2cfa.trans.passes.preprocess.PreprocessingIssue;

public class IssueFormattingVisitorTest {

	private static final String NL = System.lineSeparator();

	@Test
	public void testIssueInFileContext() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		IssueContext fileCtx = ctx.withContext(new WhileTranslatingFile(Paths.get("a.c"), "c"));
		fileCtx.error(new UnsupportedFeatureIssue("pointer declaration", 2));
		assertThat(ctx.hasErrors(), is(true));
		assertThat(ctx.format(), is("Detected 1 issue(s):" + NL
				+ "while translating a.c as c" + NL
				+ "    unsupported construct at line 2: pointer declaration"));
	}

	@Test
	public void testPreprocessorOutputIsIndented() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.error(new PreprocessingIssue(Arrays.asList("cpp"), "preprocessor exited with status 1",
				"a.c:1: error\nfatal\n", null));
		assertThat(ctx.format(), is("Detected 1 issue(s):" + NL
				+ "preprocessing failed: preprocessor exited with status 1" + NL
				+ "    a.c:1: error" + NL
				+ "    fatal"));
	}

	@Test
	public void testUnknownLanguage() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.error(new UnknownLanguageIssue("go", Collections.singletonList("c")));
		assertThat(ctx.format(), endsWith("no front end for language 'go'; known languages are c"));
	}

}
