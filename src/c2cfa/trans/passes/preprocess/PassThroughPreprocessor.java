package c2cfa.trans.passes.preprocess;

import java.nio.file.Path;

/**
 * Leaves the source untouched, for input that is already free of macros.
 */
public class PassThroughPreprocessor implements CPreprocessor {

	@Override
	public String preprocess(Path file, String source) {
		return source;
	}

}
