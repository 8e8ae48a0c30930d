package c2cfa.trans.passes.preprocess;

import c2cfa.errors.Issue;
import c2cfa.errors.IssueVisitor;

import java.util.List;

public class PreprocessingIssue extends Issue {

	private final List<String> command;
	private final String detail;
	private final String output;

	public PreprocessingIssue(List<String> command, String detail, String output, Exception cause) {
		this.command = command;
		this.detail = detail;
		this.output = output;
		if (cause != null) {
			initCause(cause);
		}
	}

	public List<String> getCommand() {
		return command;
	}

	public String getDetail() {
		return detail;
	}

	/**
	 * @return what the preprocessor printed, or null if it never ran to completion
	 */
	public String getOutput() {
		return output;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
