package c2cfa.frontend;

import c2cfa.errors.Issue;
import c2cfa.model.c.CTranslationUnit;
import c2cfa.model.cfa.Program;
import c2cfa.model.cfa.TranslationWarning;
import c2cfa.trans.passes.cfa.CfaGenerationPass;
import c2cfa.trans.passes.parse.CParsingPass;
import c2cfa.trans.passes.preprocess.CPreprocessor;
import c2cfa.trans.passes.preprocess.PreprocessingPass;
import c2cfa.trans.passes.preprocess.SourceDirectives;

import java.nio.file.Path;
import java.util.logging.Logger;

public class CFrontend implements LanguageFrontend {

	public static final String LANGUAGE = "c";

	private static final Logger logger = Logger.getLogger("CFrontend");

	private final CPreprocessor preprocessor;
	private final boolean suppressBreakContinue;

	public CFrontend(CPreprocessor preprocessor, boolean suppressBreakContinue) {
		this.preprocessor = preprocessor;
		this.suppressBreakContinue = suppressBreakContinue;
	}

	@Override
	public String getLanguage() {
		return LANGUAGE;
	}

	static String programName(Path file) {
		String name = file.getFileName().toString();
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}

	@Override
	public TranslationResult translate(Path file, String source) {
		Program program = new Program(programName(file));
		SourceDirectives directives = SourceDirectives.scan(source);
		program.setIncorrect(directives.isIncorrect());
		program.setFeedback(directives.getFeedback());

		try {
			logger.info("Preprocessing " + file);
			String preprocessed = PreprocessingPass.perform(preprocessor, file, source);

			logger.info("Parsing C");
			CTranslationUnit unit = CParsingPass.perform(file, preprocessed);

			logger.info("Generating control-flow automaton");
			CfaGenerationPass.perform(program, unit, suppressBreakContinue);
		} catch (Issue issue) {
			logger.fine("translation of " + file + " stopped: " + issue.getMessage());
			return TranslationResult.failure(issue);
		}

		for (TranslationWarning warning : program.getWarnings()) {
			logger.warning(file + ": " + warning.getMessage());
		}
		logger.fine("translated " + program.getFunctions().size() + " function(s)");
		return TranslationResult.success(program);
	}

}
