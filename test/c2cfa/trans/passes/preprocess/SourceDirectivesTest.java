package c2cfa.trans.passes.preprocess;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class SourceDirectivesTest {

	@Test
	public void testNoDirectives() {
		SourceDirectives directives = SourceDirectives.scan("int main() { return 0; }\n");
		assertThat(directives.isIncorrect(), is(false));
		assertThat(directives.getFeedback(), is(nullValue()));
	}

	@Test
	public void testIncorrectAndFeedback() {
		SourceDirectives directives = SourceDirectives.scan(
				"// #incorrect\n  // #feedback Loop bound is off by one\n// #feedback second\nint x;\n");
		assertThat(directives.isIncorrect(), is(true));
		assertThat(directives.getFeedback(), is("Loop bound is off by one"));
	}

	@Test
	public void testDirectiveNeedsSpaceAfterSlashes() {
		assertThat(SourceDirectives.scan("//#incorrect\n").isIncorrect(), is(false));
	}

	@Test
	public void testDirectiveMustStartTheLine() {
		assertThat(SourceDirectives.scan("int x; // #incorrect\n").isIncorrect(), is(false));
	}

}
