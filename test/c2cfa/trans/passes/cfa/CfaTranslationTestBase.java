package c2cfa.trans.passes.cfa;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.List;

import c2cfa.model.c.CTranslationUnit;
import c2cfa.model.cfa.*;
import c2cfa.trans.passes.parse.CParsingPass;

public abstract class CfaTranslationTestBase {

	protected static Program translate(String source) {
		return translate(source, false);
	}

	protected static Program translate(String source, boolean suppressBreakContinue) {
		CTranslationUnit unit = CParsingPass.perform(Paths.get("test.c"), source);
		return translate(unit, suppressBreakContinue);
	}

	protected static Program translate(CTranslationUnit unit, boolean suppressBreakContinue) {
		Program program = new Program("test");
		CfaGenerationPass.perform(program, unit, suppressBreakContinue);
		return program;
	}

	protected static UnsupportedFeatureIssue translationFailure(String source) {
		try {
			translate(source);
		} catch (UnsupportedFeatureIssue issue) {
			return issue;
		}
		fail("expected the translation to fail:\n" + source);
		return null;
	}

	protected static Variable v(String name) {
		return new Variable(name);
	}

	protected static Constant c(String value) {
		return new Constant(value);
	}

	protected static Operation op(String name, Expression... args) {
		return new Operation(name, -1, args);
	}

	protected static Update upd(String variable, Expression expression) {
		return new Update(variable, expression);
	}

	protected static Location location(CfaFunction fn, String description) {
		for (Location location : fn.getLocations()) {
			if (description.equals(location.getDescription())) {
				return location;
			}
		}
		fail("no location described as \"" + description + "\"");
		return null;
	}

	protected static Transition transition(CfaFunction fn, Location from, Location to) {
		for (Transition t : fn.getTransitionsFrom(from)) {
			if (t.getTo() == to) {
				return t;
			}
		}
		fail("no transition " + from + " -> " + to);
		return null;
	}

	/**
	 * Asserts that two functions have the same locations, updates and
	 * transitions, regardless of descriptions.
	 */
	protected static void assertSameAutomaton(CfaFunction expected, CfaFunction actual) {
		assertThat(actual.getLocations().size(), is(expected.getLocations().size()));
		for (int i = 0; i < expected.getLocations().size(); ++i) {
			assertThat("updates of L" + i, actual.getLocations().get(i).getUpdates(),
					is(expected.getLocations().get(i).getUpdates()));
		}
		List<Transition> expectedTransitions = expected.getTransitions();
		List<Transition> actualTransitions = actual.getTransitions();
		assertThat(actualTransitions.size(), is(expectedTransitions.size()));
		for (int i = 0; i < expectedTransitions.size(); ++i) {
			Transition e = expectedTransitions.get(i);
			Transition a = actualTransitions.get(i);
			assertThat(a.toString(), a.getFrom().getId(), is(e.getFrom().getId()));
			assertThat(a.toString(), a.getTo().getId(), is(e.getTo().getId()));
			assertThat(a.toString(), a.getGuard(), is(e.getGuard()));
		}
	}

}
