package c2cfa.frontend;

import c2cfa.trans.passes.preprocess.CPreprocessor;
import c2cfa.trans.passes.preprocess.ExternalCPreprocessor;
import c2cfa.trans.passes.preprocess.PassThroughPreprocessor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Language tag to front end mapping, fixed once built.
 */
public class FrontendRegistry {

	private final Map<String, LanguageFrontend> frontends;

	private FrontendRegistry(Map<String, LanguageFrontend> frontends) {
		this.frontends = Collections.unmodifiableMap(new LinkedHashMap<>(frontends));
	}

	public static class Builder {
		private final Map<String, LanguageFrontend> frontends = new LinkedHashMap<>();

		public Builder register(LanguageFrontend frontend) {
			if (frontends.containsKey(frontend.getLanguage())) {
				throw new IllegalArgumentException("language '" + frontend.getLanguage() + "' registered twice");
			}
			frontends.put(frontend.getLanguage(), frontend);
			return this;
		}

		public FrontendRegistry build() {
			return new FrontendRegistry(frontends);
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	public static FrontendRegistry withDefaults(TranslationOptions options) {
		CPreprocessor preprocessor = options.isPreprocessingEnabled()
				? new ExternalCPreprocessor(options.getPreprocessorCommand())
				: new PassThroughPreprocessor();
		return builder()
				.register(new CFrontend(preprocessor, options.isSuppressingBreakContinue()))
				.build();
	}

	/**
	 * @throws UnknownLanguageIssue if nothing is registered under the tag
	 */
	public LanguageFrontend lookup(String tag) throws UnknownLanguageIssue {
		LanguageFrontend frontend = frontends.get(tag);
		if (frontend == null) {
			throw new UnknownLanguageIssue(tag, frontends.keySet());
		}
		return frontend;
	}

	public Set<String> getLanguages() {
		return frontends.keySet();
	}

}
