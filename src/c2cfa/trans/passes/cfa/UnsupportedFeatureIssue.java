package c2cfa.trans.passes.cfa;

import c2cfa.errors.Issue;
import c2cfa.errors.IssueVisitor;

/**
 * A construct outside the translatable subset of C. Translation of the whole
 * unit stops here.
 */
public class UnsupportedFeatureIssue extends Issue {

	private final String description;
	private final int line;

	public UnsupportedFeatureIssue(String description, int line) {
		this.description = description;
		this.line = line;
	}

	public String getDescription() {
		return description;
	}

	public int getLine() {
		return line;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
