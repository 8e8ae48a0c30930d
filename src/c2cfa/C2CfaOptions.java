package c2cfa;

import c2cfa.frontend.CFrontend;
import c2cfa.frontend.TranslationOptions;
import c2cfa.trans.passes.preprocess.ExternalCPreprocessor;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class C2CfaOptions {
	public static final String VERSION = "0.1.0";

	public static final String FORMAT_TEXT = "text";
	public static final String FORMAT_JSON = "json";

	@Option(value = "Print the version and exit", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information")
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution")
	public boolean quiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution")
	public boolean verbose = false;

	@Option(value = "-c Path to a JSON configuration file, if any")
	public String config;

	@Option(value = "-o Write the translation to this file instead of standard output")
	public String output;

	@Option(value = "-f Output format: text or json")
	public String format = FORMAT_TEXT;

	@Option(value = "-l Language of the input file")
	public String language = CFrontend.LANGUAGE;

	@Option(value = "-n Drop break and continue statements instead of translating them into jumps")
	public boolean noBreakContinue = false;

	public String inputFilePath;

	// fields extracted from the JSON configuration file
	public List<String> preprocessorCommand = new ArrayList<>(ExternalCPreprocessor.DEFAULT_COMMAND);
	public boolean preprocessingEnabled = true;
	public boolean suppressBreakContinue = false;

	private Options plumeOptions;
	private String[] remainingArgs;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public C2CfaOptions(String[] args) throws C2CfaOptionException {
		plumeOptions = new Options("c2cfa [options] file.c", this);
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new C2CfaOptionException(e.getMessage());
		}
	}

	public void parse() throws C2CfaOptionException {
		if (version || help) {
			return;
		}

		if (remainingArgs.length != 1) {
			throw new C2CfaOptionException("expected exactly one input file, got " + remainingArgs.length);
		}
		inputFilePath = remainingArgs[0];

		if (!format.equals(FORMAT_TEXT) && !format.equals(FORMAT_JSON)) {
			throw new C2CfaOptionException("unknown output format '" + format + "'");
		}

		if (config != null && !config.isEmpty()) {
			readConfig();
		}
		// the command line wins over the configuration file
		if (noBreakContinue) {
			suppressBreakContinue = true;
		}
	}

	private void readConfig() throws C2CfaOptionException {
		String s;
		try {
			s = FileUtils.readFileToString(new File(config), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new C2CfaOptionException("Error reading configuration file: " + ex.getMessage());
		}

		try {
			JSONObject json = new JSONObject(s);
			JSONObject preprocessor = json.optJSONObject("preprocessor");
			if (preprocessor != null) {
				preprocessingEnabled = preprocessor.optBoolean("enabled", preprocessingEnabled);
				JSONArray command = preprocessor.optJSONArray("command");
				if (command != null) {
					if (command.length() == 0) {
						throw new C2CfaOptionException(config + ": preprocessor.command must not be empty");
					}
					preprocessorCommand = new ArrayList<>();
					for (int i = 0; i < command.length(); ++i) {
						preprocessorCommand.add(command.getString(i));
					}
				}
			}
			JSONObject translation = json.optJSONObject("translation");
			if (translation != null) {
				suppressBreakContinue = translation.optBoolean("suppressBreakContinue", suppressBreakContinue);
			}
		} catch (JSONException e) {
			throw new C2CfaOptionException(config + ": parsing error: " + e.getMessage());
		}
	}

	public TranslationOptions toTranslationOptions() {
		return new TranslationOptions(preprocessingEnabled, preprocessorCommand, suppressBreakContinue);
	}
}
