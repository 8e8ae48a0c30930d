package c2cfa.trans.passes.cfa;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import c2cfa.model.cfa.*;

public class CExpressionCfaVisitorTest extends CfaTranslationTestBase {

	private static CfaFunction main(String body) {
		return translate("int main() {\n" + body + "\n}").getFunction("main");
	}

	@Test
	public void testPostfixUpdateComesAfterAssignment() {
		CfaFunction fn = main("int x = 0;\nint y;\ny = x++;\nreturn y;");
		assertThat(fn.getLocations().size(), is(1));
		assertThat(fn.getEntry().getUpdates(), is(Arrays.asList(
				upd("x", c("0")),
				upd("y", v("x")),
				upd("x", op("+", v("x"), c("1"))),
				upd(Variable.RET, v("y")))));
	}

	@Test
	public void testPrefixUpdateComesBeforeAssignment() {
		CfaFunction fn = main("int x = 0;\nint y;\ny = ++x;");
		assertThat(fn.getEntry().getUpdates(), is(Arrays.asList(
				upd("x", c("0")),
				upd("x", op("+", v("x"), c("1"))),
				upd("y", v("x")))));
	}

	@Test
	public void testPostfixAndPrefixOfOneVariable() {
		CfaFunction fn = main("int x;\nint y;\ny = x++ + ++x;");
		assertThat(fn.getEntry().getUpdates(), is(Arrays.asList(
				upd("x", op("+", v("x"), c("1"))),
				upd("y", op("+", v("x"), v("x"))),
				upd("x", op("+", v("x"), c("1"))))));
	}

	@Test
	public void testShiftAssignmentFails() {
		UnsupportedFeatureIssue issue = translationFailure("int main() {\n  int x;\n  x <<= 2;\n}");
		assertThat(issue.getDescription(), is("assignment operator '<<='"));
		assertThat(issue.getLine(), is(3));
	}

	@Test
	public void testAssignedPrintfIsUnknown() {
		CfaFunction fn = main("int y;\ny = printf(\"a\");");
		assertThat(fn.getEntry().getUpdates().get(1), is(upd("y", c(Constant.UNKNOWN_FORMAT))));
	}

	@Test
	public void testPostfixDecrementOnItsOwn() {
		CfaFunction fn = main("int x;\nx--;");
		assertThat(fn.getEntry().getUpdates(), is(Collections.singletonList(
				upd("x", op("-", v("x"), c("1"))))));
	}

	@Test
	public void testCommaCompletesEarlierIncrements() {
		CfaFunction fn = main("int x;\nint y;\ny = (x++, x);");
		assertThat(fn.getEntry().getUpdates(), is(Arrays.asList(
				upd("x", op("+", v("x"), c("1"))),
				upd("y", v("x")))));
	}

	@Test
	public void testCompoundAssignment() {
		CfaFunction fn = main("int x;\nx *= 2 + x;");
		assertThat(fn.getEntry().getUpdates(), is(Collections.singletonList(
				upd("x", op("*", v("x"), op("+", c("2"), v("x")))))));
	}

	@Test
	public void testArrayElementAssignment() {
		CfaFunction fn = main("int a[3];\na[1] = 5;\na[2] += a[1];");
		assertThat(fn.getEntry().getUpdates(), is(Arrays.asList(
				upd("a", op(Operation.ARRAY_CREATE, c("3"))),
				upd("a", op(Operation.ARRAY_ASSIGN, v("a"), c("1"), c("5"))),
				upd("a", op(Operation.ARRAY_ASSIGN, v("a"), c("2"),
						op("+", op(Operation.INDEX, v("a"), c("2")), op(Operation.INDEX, v("a"), c("1"))))))));
	}

	@Test
	public void testPureTernaryIsIte() {
		CfaFunction fn = main("int x;\nint y;\ny = x > 0 ? 1 : 2;");
		assertThat(fn.getLocations().size(), is(1));
		assertThat(fn.getEntry().getUpdates(), is(Collections.singletonList(
				upd("y", op(Operation.ITE, op(">", v("x"), c("0")), c("1"), c("2"))))));
	}

	@Test
	public void testTernaryWithSideEffectsBecomesBranches() {
		CfaFunction fn = main("int x;\nint y;\ny = x > 0 ? x++ : 2;");
		assertThat(fn.getLocations().size(), is(4));
		// nothing of the first attempt is left on the entry
		assertThat(fn.getEntry().getUpdates(), is(Collections.<Update>emptyList()));

		Location yes = location(fn, "inside the if-branch starting at line 4");
		Location no = location(fn, "inside the else-branch starting at line 4");
		Location join = location(fn, "after the if-statement beginning at line 4");
		Expression condition = op(">", v("x"), c("0"));
		assertThat(transition(fn, fn.getEntry(), yes).getGuard(), is(Guard.when(condition)));
		assertThat(transition(fn, fn.getEntry(), no).getGuard(), is(Guard.unless(condition)));
		assertThat(yes.getUpdates(), is(Collections.singletonList(upd("x", op("+", v("x"), c("1"))))));
		assertThat(no.getUpdates(), is(Collections.<Update>emptyList()));
		assertThat(join.getUpdates(), is(Collections.singletonList(upd("y", c(Constant.UNKNOWN_FORMAT)))));
	}

	@Test
	public void testTernaryAtFileScope() {
		Program program = translate("int g = 1 ? 2 : 3;");
		assertThat(program.getGlobalUpdates(), is(Collections.singletonList(
				upd("g", op(Operation.ITE, c("1"), c("2"), c("3"))))));
	}

	@Test
	public void testLibraryFunctionCall() {
		CfaFunction fn = main("double x;\ndouble y;\ny = sqrt(x) + pow(x, 2);");
		assertThat(fn.getEntry().getUpdates(), is(Collections.singletonList(
				upd("y", op("+", op("sqrt", v("x")), op("pow", v("x"), c("2")))))));
	}

	@Test
	public void testCastSizeofAndEof() {
		CfaFunction fn = main("float f;\nint y;\ny = (int) f;\ny = sizeof(int);\ny = EOF;");
		assertThat(fn.getEntry().getUpdates(), is(Arrays.asList(
				upd("y", op(Operation.CAST, c("int"), v("f"))),
				upd("y", op("sizeof", c("int"))),
				upd("y", c("EOF")))));
	}

	@Test
	public void testUnknownFunctionFails() {
		UnsupportedFeatureIssue issue = translationFailure("int main() {\n  foo(1);\n}");
		assertThat(issue.getDescription(), is("unsupported function call 'foo'"));
		assertThat(issue.getLine(), is(2));
	}

	@Test
	public void testIncrementOfExpressionFails() {
		UnsupportedFeatureIssue issue = translationFailure("int main() {\n  int x;\n  (x + 1)++;\n}");
		assertThat(issue.getDescription(), containsString("applied to something other than a variable"));
	}

	@Test
	public void testValuelessOperandFails() {
		UnsupportedFeatureIssue issue = translationFailure("int main() {\n  int y;\n  y = printf(\"a\") + 1;\n}");
		assertThat(issue.getDescription(), is("expression without a value used as an operand"));
	}

	@Test
	public void testAssignmentToNonVariableFails() {
		UnsupportedFeatureIssue issue = translationFailure("int main() {\n  int x;\n  (x + 1) = 2;\n}");
		assertThat(issue.getDescription(), containsString("assignment to"));
	}

}
