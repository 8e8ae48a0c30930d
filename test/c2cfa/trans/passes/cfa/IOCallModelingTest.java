package c2cfa.trans.passes.cfa;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import c2cfa.model.cfa.*;

public class IOCallModelingTest extends CfaTranslationTestBase {

	private static Program inMain(String statement) {
		return translate("int main() {\n  int x; int y; int a[3];\n  " + statement + "\n}");
	}

	/**
	 * @return the updates scheduled after the creation of the array
	 */
	private static List<Update> updatesOf(Program program) {
		List<Update> updates = program.getFunction("main").getEntry().getUpdates();
		assertThat(updates.get(0), is(upd("a", op(Operation.ARRAY_CREATE, c("3")))));
		return updates.subList(1, updates.size());
	}

	private static Expression read(String type) {
		return op(Operation.LIST_HEAD, c(type), v(Variable.IN));
	}

	private static Update consume() {
		return upd(Variable.IN, op(Operation.LIST_TAIL, v(Variable.IN)));
	}

	@Test
	public void testScanfReadsInOrder() {
		Program program = inMain("scanf(\"%d %d\", &x, &y);");
		assertThat(updatesOf(program), is(Arrays.asList(
				upd("x", read("int")),
				consume(),
				upd("y", read("int")),
				consume())));
		assertThat(program.getWarnings().isEmpty(), is(true));
	}

	@Test
	public void testScanfIntoArrayElement() {
		Program program = inMain("scanf(\"%lf\", &a[1]);");
		assertThat(updatesOf(program), is(Arrays.asList(
				upd("a", op(Operation.ARRAY_ASSIGN, v("a"), c("1"), read("float"))),
				consume())));
	}

	@Test
	public void testPrintfNormalisesLongSpecifiers() {
		Program program = inMain("printf(\"%ld\\n\", x);");
		assertThat(updatesOf(program), is(Collections.singletonList(
				upd(Variable.OUT, op(Operation.STR_APPEND, v(Variable.OUT),
						op(Operation.STR_FORMAT, c("\"%d\\n\""), v("x")))))));
	}

	@Test
	public void testPrintfWithoutFormat() {
		Program program = inMain("printf(x);");
		assertThat(program.getWarnings().get(0).getMessage(),
				is("First argument of 'printf' at line 3 should be a format"));
		assertThat(updatesOf(program), is(Collections.singletonList(
				upd(Variable.OUT, op(Operation.STR_APPEND, v(Variable.OUT),
						op(Operation.STR_FORMAT, c(Constant.UNKNOWN_FORMAT), v("x")))))));
	}

	@Test
	public void testForgottenAddressOf() {
		Program program = inMain("scanf(\"%d\", x);");
		assertThat(program.getWarnings().get(0).getMessage(), is("Forgotten '&' in 'scanf' at line 3?"));
		assertThat(updatesOf(program), is(Arrays.asList(upd("x", read("int")), consume())));
	}

	@Test
	public void testFormatArgumentMismatch() {
		Program program = inMain("scanf(\"%d %d\", &x);");
		assertThat(program.getWarnings().get(0).getMessage(),
				is("Mismatch between format and number of argument(s) of 'scanf' at line 3."));
		assertThat(updatesOf(program).size(), is(2));
	}

	@Test
	public void testExtraArgumentsReadAnything() {
		Program program = inMain("scanf(\"%c\", &x, &y);");
		assertThat(updatesOf(program), is(Arrays.asList(
				upd("x", read("char")), consume(),
				upd("y", read(IOCallModeling.ANY_TYPE)), consume())));
	}

	@Test
	public void testInvalidSpecifier() {
		Program program = inMain("scanf(\"%q\", &x);");
		assertThat(program.getWarnings().get(0).getMessage(), is("Invalid 'scanf' format %q at line 3."));
		assertThat(updatesOf(program).get(0), is(upd("x", read(IOCallModeling.ANY_TYPE))));
	}

	@Test
	public void testScanfIntoConstantFails() {
		UnsupportedFeatureIssue issue = translationFailure("int main() {\n  scanf(\"%d\", 5);\n}");
		assertThat(issue.getDescription(), is("argument to scanf: '5'"));
	}

	@Test
	public void testSpecifiers() {
		assertThat(IOCallModeling.specifiers("%d%%x %5s %lld"), is(Arrays.asList("%d", "%s", "%lld")));
	}

}
