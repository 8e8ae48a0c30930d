package c2cfa.trans.passes.preprocess;

import c2cfa.errors.Issue;
import c2cfa.errors.IssueVisitor;

import java.io.IOException;
import java.nio.file.Path;

public class SourceReadingIssue extends Issue {

	private final Path file;
	private final IOException error;

	public SourceReadingIssue(Path file, IOException error) {
		initCause(error);
		this.file = file;
		this.error = error;
	}

	public Path getFile() {
		return file;
	}

	public IOException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
