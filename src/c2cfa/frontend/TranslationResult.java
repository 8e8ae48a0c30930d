package c2cfa.frontend;

import c2cfa.errors.Issue;
import c2cfa.model.cfa.Program;

/**
 * Outcome of translating one file: the complete program, or the issue that
 * stopped the translation. A failed translation has no partial program.
 */
public class TranslationResult {

	private final Program program;
	private final Issue issue;

	private TranslationResult(Program program, Issue issue) {
		this.program = program;
		this.issue = issue;
	}

	public static TranslationResult success(Program program) {
		return new TranslationResult(program, null);
	}

	public static TranslationResult failure(Issue issue) {
		return new TranslationResult(null, issue);
	}

	public boolean isSuccess() {
		return program != null;
	}

	public Program getProgram() {
		if (program == null) {
			throw new IllegalStateException("translation failed: " + issue.getMessage());
		}
		return program;
	}

	public Issue getIssue() {
		if (issue == null) {
			throw new IllegalStateException("translation succeeded");
		}
		return issue;
	}

}
