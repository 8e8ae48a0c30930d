package c2cfa.trans.passes.parse.option;

import c2cfa.C2CfaOptionException;
import c2cfa.C2CfaOptions;
import c2cfa.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	/**
	 * @return the parsed options, or null if the command line could not be read at all
	 */
	public static C2CfaOptions perform(IssueContext ctx, Logger logger, String[] args) {
		C2CfaOptions opts;
		try {
			opts = new C2CfaOptions(args);
		} catch (C2CfaOptionException e) {
			ctx.error(new OptionParserIssue(e.getMsg()));
			return null;
		}
		try {
			opts.parse();
		} catch (C2CfaOptionException e) {
			ctx.error(new OptionParserIssue(e.getMsg()));
		}
		// set the log level based on command line arguments
		Level level;
		if (opts.quiet) {
			level = Level.WARNING;
		} else if (opts.verbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		Logger root = Logger.getLogger("");
		root.setLevel(level);
		for (Handler handler : root.getHandlers()) {
			handler.setLevel(level);
		}
		return opts;
	}
}
