package c2cfa.trans.passes.preprocess;

import java.nio.file.Path;

/**
 * Expands macros and removes comments, leaving cpp line markers behind so that
 * the lexer can report original line numbers.
 */
public interface CPreprocessor {

	String preprocess(Path file, String source) throws PreprocessingIssue;

}
