package c2cfa.errors;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import c2cfa.Unreachable;
import c2cfa.formatters.IndentingWriter;
import c2cfa.formatters.IssueFormattingVisitor;

/**
 * Collects every issue reported during a run of the translator, in the order they
 * were reported.
 */
public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> issues = new ArrayList<>();

	@Override
	public void error(Issue err) {
		issues.add(err);
	}

	@Override
	public boolean hasErrors() {
		return !issues.isEmpty();
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

	public void format(IndentingWriter out) throws IOException {
		out.write("Detected " + issues.size() + " issue(s):");
		IssueFormattingVisitor formatter = new IssueFormattingVisitor(out);
		for (Issue issue : issues) {
			out.newLine();
			issue.accept(formatter);
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		try {
			format(new IndentingWriter(w));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
