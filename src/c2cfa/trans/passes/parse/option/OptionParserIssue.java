package c2cfa.trans.passes.parse.option;

import c2cfa.errors.Issue;
import c2cfa.errors.IssueVisitor;

public class OptionParserIssue extends Issue {

	private final String detail;

	public OptionParserIssue(String detail) {
		this.detail = detail;
	}

	public String getDetail() {
		return detail;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
