package c2cfa.frontend;

import java.nio.file.Path;

/**
 * Turns the source text of one file into a translated program.
 */
public interface LanguageFrontend {

	/**
	 * @return the tag the front end is registered under, such as <code>c</code>
	 */
	String getLanguage();

	TranslationResult translate(Path file, String source);

}
