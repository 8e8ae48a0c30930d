package c2cfa.frontend;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Collections;

import org.junit.Test;

import c2cfa.trans.passes.preprocess.PassThroughPreprocessor;

public class FrontendRegistryTest {

	@Test
	public void testDefaults() {
		FrontendRegistry registry = FrontendRegistry.withDefaults(TranslationOptions.defaults());
		assertThat(registry.getLanguages(), is(Collections.singleton(CFrontend.LANGUAGE)));
		assertThat(registry.lookup("c"), instanceOf(CFrontend.class));
	}

	@Test
	public void testUnknownLanguage() {
		FrontendRegistry registry = FrontendRegistry.withDefaults(TranslationOptions.defaults());
		try {
			registry.lookup("python");
			fail("expected an unknown language");
		} catch (UnknownLanguageIssue issue) {
			assertThat(issue.getTag(), is("python"));
			assertThat(issue.getKnownTags(), is(Collections.singletonList("c")));
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testLanguageRegisteredTwice() {
		FrontendRegistry.builder()
				.register(new CFrontend(new PassThroughPreprocessor(), false))
				.register(new CFrontend(new PassThroughPreprocessor(), true));
	}

}
