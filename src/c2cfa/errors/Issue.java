package c2cfa.errors;

import c2cfa.Unreachable;
import c2cfa.formatters.IndentingWriter;
import c2cfa.formatters.IssueFormattingVisitor;
import c2cfa.trans.TranslationException;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem with the input that stops its translation. Issues are thrown out of
 * the pass that finds them and reported through an {@link IssueContext}; their
 * message is their formatted form.
 */
public abstract class Issue extends TranslationException {

	protected Issue() {
		super("");
	}

	@Override
	public String getMessage() {
		StringWriter w = new StringWriter();
		try {
			accept(new IssueFormattingVisitor(new IndentingWriter(w)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

	/**
	 * @return this issue, explained as having happened in the given context
	 */
	public Issue withContext(Context context) {
		return new IssueWithContext(this, context);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
