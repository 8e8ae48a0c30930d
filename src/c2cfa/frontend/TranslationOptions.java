package c2cfa.frontend;

import c2cfa.trans.passes.preprocess.ExternalCPreprocessor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings shared by all front ends.
 */
public class TranslationOptions {

	private final boolean preprocessingEnabled;
	private final List<String> preprocessorCommand;
	private final boolean suppressBreakContinue;

	public TranslationOptions(boolean preprocessingEnabled, List<String> preprocessorCommand,
	                          boolean suppressBreakContinue) {
		this.preprocessingEnabled = preprocessingEnabled;
		this.preprocessorCommand = Collections.unmodifiableList(new ArrayList<>(preprocessorCommand));
		this.suppressBreakContinue = suppressBreakContinue;
	}

	public static TranslationOptions defaults() {
		return new TranslationOptions(true, ExternalCPreprocessor.DEFAULT_COMMAND, false);
	}

	public boolean isPreprocessingEnabled() {
		return preprocessingEnabled;
	}

	public List<String> getPreprocessorCommand() {
		return preprocessorCommand;
	}

	public boolean isSuppressingBreakContinue() {
		return suppressBreakContinue;
	}

}
