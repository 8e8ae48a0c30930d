package c2cfa.trans.passes.cfa;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import c2cfa.model.cfa.*;

public class CStatementCfaVisitorTest extends CfaTranslationTestBase {

	@Test
	public void testIfElse() {
		CfaFunction fn = translate("int main() {\n  int x;\n  if (x) x = 1; else x = 2;\n  return x;\n}")
				.getFunction("main");
		assertThat(fn.getLocations().size(), is(4));
		Location yes = location(fn, "inside the if-branch starting at line 3");
		Location no = location(fn, "inside the else-branch starting at line 3");
		Location join = location(fn, "after the if-statement beginning at line 3");
		assertThat(transition(fn, fn.getEntry(), yes).getGuard(), is(Guard.when(v("x"))));
		assertThat(transition(fn, fn.getEntry(), no).getGuard(), is(Guard.unless(v("x"))));
		assertThat(transition(fn, yes, join).getGuard(), is(Guard.always()));
		assertThat(transition(fn, no, join).getGuard(), is(Guard.always()));
		assertThat(yes.getUpdates(), is(Collections.singletonList(upd("x", c("1")))));
		assertThat(no.getUpdates(), is(Collections.singletonList(upd("x", c("2")))));
		assertThat(join.getUpdates(), is(Collections.singletonList(upd(Variable.RET, v("x")))));
	}

	@Test
	public void testIfWithoutElseStillJoins() {
		CfaFunction fn = translate("int main() {\n  int x;\n  if (x > 1) x = 1;\n}").getFunction("main");
		Location no = location(fn, "inside the else-branch starting at line 3");
		assertThat(no.getUpdates(), is(Collections.<Update>emptyList()));
		transition(fn, no, location(fn, "after the if-statement beginning at line 3"));
	}

	@Test
	public void testWhileLoop() {
		CfaFunction fn = translate("int main() {\n  int i = 0;\n  while (i < 10) {\n    i++;\n  }\n  return i;\n}")
				.getFunction("main");
		Location condition = location(fn, "the condition of the 'while' loop at line 3");
		Location body = location(fn, "inside the body of the 'while' loop beginning at line 3");
		Location exit = location(fn, "after the 'while' loop starting at line 3");
		Expression test = op("<", v("i"), c("10"));

		assertThat(fn.getTransitions().size(), is(4));
		assertThat(transition(fn, fn.getEntry(), condition).getGuard(), is(Guard.always()));
		assertThat(transition(fn, condition, body).getGuard(), is(Guard.when(test)));
		assertThat(transition(fn, condition, exit).getGuard(), is(Guard.unless(test)));
		assertThat(transition(fn, body, condition).getGuard(), is(Guard.always()));
		assertThat(body.getUpdates(), is(Collections.singletonList(upd("i", op("+", v("i"), c("1"))))));
		assertThat(exit.getUpdates(), is(Collections.singletonList(upd(Variable.RET, v("i")))));
		assertThat(fn.usesNonLocalExits(), is(false));
	}

	@Test
	public void testDoWhileEntersTheBodyFirst() {
		CfaFunction fn = translate("int main() {\n  int i = 0;\n  do {\n    i++;\n  } while (i < 10);\n}")
				.getFunction("main");
		Location condition = location(fn, "the condition of the 'do-while' loop at line 3");
		Location body = location(fn, "inside the body of the 'do-while' loop beginning at line 3");
		assertThat(fn.getTransitionsFrom(fn.getEntry()).size(), is(1));
		transition(fn, fn.getEntry(), body);
		transition(fn, body, condition);
	}

	@Test
	public void testForLoopWithoutCondition() {
		CfaFunction fn = translate("int main() {\n  int i;\n  for (i = 0; ; i++) {\n  }\n}").getFunction("main");
		Location condition = location(fn, "the condition of the 'for' loop at line 3");
		Location body = location(fn, "inside the body of the 'for' loop beginning at line 3");
		Location update = location(fn, "update of the 'for' loop at line 3");
		assertThat(fn.getEntry().getUpdates(), is(Collections.singletonList(upd("i", c("0")))));
		assertThat(transition(fn, condition, body).getGuard(), is(Guard.when(c("1"))));
		transition(fn, body, update);
		transition(fn, update, condition);
		assertThat(update.getUpdates(), is(Collections.singletonList(upd("i", op("+", v("i"), c("1"))))));
	}

	private static final String NESTED_LOOPS = String.join("\n",
			"int main() {",
			"  int i; int j;",
			"  for (i = 0; i < 3; i++) {",
			"    for (j = 0; j < 3; j++) {",
			"      if (j == 1) continue;",
			"      if (j == 2) break;",
			"    }",
			"  }",
			"  return 0;",
			"}");

	@Test
	public void testBreakAndContinueTargetTheInnermostLoop() {
		CfaFunction fn = translate(NESTED_LOOPS).getFunction("main");
		assertThat(fn.usesNonLocalExits(), is(true));
		Location continueFrom = location(fn, "inside the if-branch starting at line 5");
		Location breakFrom = location(fn, "inside the if-branch starting at line 6");
		assertThat(transition(fn, continueFrom, location(fn, "update of the 'for' loop at line 4")).getGuard(),
				is(Guard.always()));
		assertThat(transition(fn, breakFrom, location(fn, "after the 'for' loop starting at line 4")).getGuard(),
				is(Guard.always()));
		// statements after a jump land on a location nothing leads to
		Location afterContinue = location(fn, "after 'continue' statement at line 5");
		for (Transition t : fn.getTransitions()) {
			assertThat(t.getTo(), not(sameInstance(afterContinue)));
		}
	}

	@Test
	public void testSuppressedBreakAndContinue() {
		CfaFunction fn = translate(NESTED_LOOPS, true).getFunction("main");
		assertThat(fn.usesNonLocalExits(), is(false));
		Location breakFrom = location(fn, "inside the if-branch starting at line 6");
		assertThat(fn.getTransitionsFrom(breakFrom).size(), is(1));
		assertThat(fn.getTransitionsFrom(breakFrom).get(0).getTo(),
				is(location(fn, "after the if-statement beginning at line 6")));
	}

	@Test
	public void testBreakOutsideLoopWarns() {
		Program program = translate("int main() {\n  break;\n  continue;\n}");
		assertThat(program.getWarnings().size(), is(2));
		assertThat(program.getWarnings().get(0).getMessage(), is("'break' outside loop at line 2"));
		assertThat(program.getWarnings().get(1).getMessage(), is("'continue' outside loop at line 3"));
		assertThat(program.getFunction("main").getTransitions().size(), is(0));
	}

	@Test
	public void testReturn() {
		CfaFunction fn = translate("void f() {\n  return;\n}\nint g(int a) {\n  return a * 2;\n}").getFunction("f");
		assertThat(fn.getEntry().getUpdates(), is(Collections.singletonList(upd(Variable.RET, c(Constant.TOP)))));
	}

	@Test
	public void testCallResultIsDiscarded() {
		Program program = translate("int f() {\n  return 1;\n}\nint main() {\n  f();\n  return f();\n}");
		Expression call = op(Operation.FUNC_CALL, v("f"));
		assertThat(program.getFunction("main").getEntry().getUpdates(), is(Arrays.asList(
				upd(Variable.DISCARD, call),
				upd(Variable.RET, call))));
	}

	@Test
	public void testLabelIsIgnored() {
		Program program = translate("int main() {\n  int x;\n  end: x = 1;\n}");
		assertThat(program.getWarnings().get(0).getMessage(), is("Ignoring label at line 3."));
		assertThat(program.getFunction("main").getEntry().getUpdates(),
				is(Collections.singletonList(upd("x", c("1")))));
	}

	@Test
	public void testGotoFails() {
		UnsupportedFeatureIssue issue = translationFailure("int main() {\n  goto end;\n  end: return 0;\n}");
		assertThat(issue.getDescription(), is("'goto end' is not supported"));
		assertThat(issue.getLine(), is(2));
	}

	@Test
	public void testLineScopes() {
		Program program = translate(NESTED_LOOPS);
		assertThat(program.getLineMap().lookup(1), is("main."));
		assertThat(program.getLineMap().lookup(3), is("main.for."));
		assertThat(program.getLineMap().lookup(6), is("main.for.for.if."));
	}

}
