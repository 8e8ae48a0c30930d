package c2cfa.frontend;

import c2cfa.errors.Issue;
import c2cfa.errors.IssueVisitor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

public class UnknownLanguageIssue extends Issue {

	private final String tag;
	private final List<String> knownTags;

	public UnknownLanguageIssue(String tag, Collection<String> knownTags) {
		this.tag = tag;
		List<String> sorted = new ArrayList<>(knownTags);
		Collections.sort(sorted);
		this.knownTags = Collections.unmodifiableList(sorted);
	}

	public String getTag() {
		return tag;
	}

	public List<String> getKnownTags() {
		return knownTags;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
