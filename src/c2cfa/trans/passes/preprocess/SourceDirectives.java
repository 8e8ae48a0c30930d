package c2cfa.trans.passes.preprocess;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Metadata carried by directive comments in the C source:
 * <code>// #incorrect</code> and <code>// #feedback &lt;text&gt;</code>.
 */
public class SourceDirectives {

	static final Pattern INCORRECT = Pattern.compile("^\\s*//\\s+#incorrect\\s*", Pattern.MULTILINE);
	static final Pattern FEEDBACK = Pattern.compile("^\\s*//\\s+#feedback\\s+(.*)", Pattern.MULTILINE);

	private final boolean incorrect;
	private final String feedback;

	public SourceDirectives(boolean incorrect, String feedback) {
		this.incorrect = incorrect;
		this.feedback = feedback;
	}

	/**
	 * Scans the raw source text; only the first feedback directive counts.
	 */
	public static SourceDirectives scan(CharSequence source) {
		boolean incorrect = INCORRECT.matcher(source).find();
		String feedback = null;
		Matcher m = FEEDBACK.matcher(source);
		if (m.find()) {
			feedback = m.group(1);
		}
		return new SourceDirectives(incorrect, feedback);
	}

	public boolean isIncorrect() {
		return incorrect;
	}

	/**
	 * @return the feedback text, or null
	 */
	public String getFeedback() {
		return feedback;
	}

}
