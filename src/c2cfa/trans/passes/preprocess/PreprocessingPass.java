package c2cfa.trans.passes.preprocess;

import java.nio.file.Path;
import java.util.regex.Pattern;

public class PreprocessingPass {
	private PreprocessingPass() {}

	static final Pattern INCLUDE = Pattern.compile("^[ \\t]*#[ \\t]*include\\b.*$", Pattern.MULTILINE);

	/**
	 * Blanks out <code>#include</code> lines, keeping the line count intact.
	 */
	public static String stripIncludes(String source) {
		return INCLUDE.matcher(source).replaceAll("");
	}

	public static String perform(CPreprocessor preprocessor, Path file, String source) throws PreprocessingIssue {
		return preprocessor.preprocess(file, stripIncludes(source));
	}

}
