package c2cfa.trans.passes.cfa;

import static c2cfa.model.c.CBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import c2cfa.model.cfa.*;

public class FunctionTranslatorTest extends CfaTranslationTestBase {

	@Test
	public void testVoidParameterListIsEmpty() {
		CfaFunction fn = translate("int f(void) {\n  return 1;\n}").getFunction("f");
		assertThat(fn.getParams(), is(Collections.<Parameter>emptyList()));
		assertThat(fn.getReturnType(), is("int"));
		assertThat(fn.isDefined(), is(true));
		assertThat(fn.getEntry().getDescription(), is("at the beginning of the function 'f' at line 1"));
	}

	@Test
	public void testParametersAreTyped() {
		CfaFunction fn = translate("double avg(int n, double xs[]) {\n  return xs[0] / n;\n}").getFunction("avg");
		assertThat(fn.getReturnType(), is("float"));
		assertThat(fn.getParams().size(), is(2));
		assertThat(fn.getParams().get(1).toString(), is("float[] xs"));
		assertThat(fn.getTypes().lookup("n"), is("int"));
	}

	@Test
	public void testPrototypeThenDefinition() {
		Program program = translate("int g(int);\nint main() {\n  return g(2);\n}\nint g(int a) {\n  return a;\n}");
		CfaFunction g = program.getFunction("g");
		assertThat(g.isDefined(), is(true));
		assertThat(g.getParams().get(0).getName(), is("a"));
		assertThat(program.getFunction("main").getEntry().getUpdates(), is(Collections.singletonList(
				upd(Variable.RET, op(Operation.FUNC_CALL, v("g"), c("2"))))));
		// the prototype keeps its place in declaration order
		assertThat(program.getFunctions().iterator().next().getName(), is("g"));
	}

	@Test
	public void testUnresolvedPrototype() {
		CfaFunction fn = translate("int h(int, float);").getFunction("h");
		assertThat(fn.isDefined(), is(false));
		assertThat(fn.getEntry(), is(nullValue()));
		assertThat(fn.getParams().get(0).getName(), is(Variable.DISCARD));
	}

	@Test
	public void testRecursiveCall() {
		CfaFunction fn = translate("int fact(int n) {\n  return n * fact(n - 1);\n}").getFunction("fact");
		assertThat(fn.getEntry().getUpdates(), is(Collections.singletonList(
				upd(Variable.RET, op("*", v("n"), op(Operation.FUNC_CALL, v("fact"), op("-", v("n"), c("1"))))))));
	}

	@Test
	public void testBuiltTree() {
		Program program = translate(unit(
				global(decl(type("int"), "total", num(0))),
				function(type("void"), "add", params(param(type("int"), "k")),
						exprS(assign("+=", id("total"), id("k"))))), false);
		assertThat(program.getGlobalUpdates(), is(Collections.singletonList(upd("total", c("0")))));
		assertThat(program.getFunction("add").getEntry().getUpdates(), is(Collections.singletonList(
				upd("total", op("+", v("total"), v("k"))))));
	}

	@Test
	public void testRedefinitionFails() {
		UnsupportedFeatureIssue issue = translationFailure("int f() {\n  return 1;\n}\nint f() {\n  return 2;\n}");
		assertThat(issue.getDescription(), is("redefinition of function 'f'"));
		assertThat(issue.getLine(), is(4));
	}

	@Test
	public void testUnnamedParameterInDefinitionFails() {
		assertThat(translationFailure("int f(int) {\n  return 1;\n}").getDescription(),
				is("unnamed parameter in a function definition"));
	}

	@Test
	public void testDuplicateParameterFails() {
		assertThat(translationFailure("int f(int a, int a) {\n  return a;\n}").getDescription(),
				is("duplicate parameter 'a'"));
	}

	@Test
	public void testPointerParameterFails() {
		assertThat(translationFailure("int f(int *p) {\n  return 0;\n}").getDescription(),
				is("parameter that is a pointer or a function"));
	}

	@Test
	public void testFunctionsInOrder() {
		Program program = translate("void a() {\n}\nvoid b() {\n}");
		assertThat(new ArrayList<>(program.getFunctions()),
				is(Arrays.asList(program.getFunction("a"), program.getFunction("b"))));
	}

}
