package c2cfa;

import c2cfa.errors.IssueContext;
import c2cfa.errors.TopLevelIssueContext;
import c2cfa.formatters.IndentingWriter;
import c2cfa.formatters.ProgramFormattingVisitor;
import c2cfa.formatters.ProgramJsonWriter;
import c2cfa.frontend.FrontendRegistry;
import c2cfa.frontend.LanguageFrontend;
import c2cfa.frontend.TranslationResult;
import c2cfa.frontend.UnknownLanguageIssue;
import c2cfa.frontend.WhileTranslatingFile;
import c2cfa.model.cfa.Program;
import c2cfa.trans.passes.parse.option.OptionParsingPass;
import c2cfa.trans.passes.preprocess.SourceReadingIssue;
import org.apache.commons.io.FileUtils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

public class C2CfaMain {
	public static final int EXIT_OK = 0;
	public static final int EXIT_TRANSLATION_FAILED = 1;
	public static final int EXIT_BAD_OPTIONS = 2;

	private String[] cmdArgs;
	private static Logger logger;

	public C2CfaMain(String[] args) {
		cmdArgs = args;
		// Get the top Logger instance
		logger = Logger.getLogger("C2CfaMain");
	}

	public static void main(String[] args) {
		int status = new C2CfaMain(args).run();
		if (status == EXIT_OK) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
		}
		System.exit(status);
	}

	// Top-level workhorse method.
	public int run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		C2CfaOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
		if (ctx.hasErrors()) {
			System.err.println(ctx.format());
			if (opts != null) {
				opts.printHelp();
			}
			return EXIT_BAD_OPTIONS;
		}
		if (opts.help) {
			opts.printHelp();
			return EXIT_OK;
		}
		if (opts.version) {
			System.out.println("c2cfa version " + C2CfaOptions.VERSION);
			return EXIT_OK;
		}

		FrontendRegistry registry = FrontendRegistry.withDefaults(opts.toTranslationOptions());
		Path inputFilePath = Paths.get(opts.inputFilePath);
		IssueContext fileCtx = ctx.withContext(new WhileTranslatingFile(inputFilePath, opts.language));

		LanguageFrontend frontend;
		try {
			frontend = registry.lookup(opts.language);
		} catch (UnknownLanguageIssue e) {
			fileCtx.error(e);
			System.err.println(ctx.format());
			return EXIT_BAD_OPTIONS;
		}

		logger.info("Opening source file");
		String source;
		try {
			source = FileUtils.readFileToString(inputFilePath.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			fileCtx.error(new SourceReadingIssue(inputFilePath, e));
			System.err.println(ctx.format());
			return EXIT_TRANSLATION_FAILED;
		}

		TranslationResult result = frontend.translate(inputFilePath, source);
		if (!result.isSuccess()) {
			fileCtx.error(result.getIssue());
			System.err.println(ctx.format());
			return EXIT_TRANSLATION_FAILED;
		}

		try {
			writeProgram(opts, result.getProgram());
		} catch (IOException e) {
			logger.severe("could not write the translation: " + e.getMessage());
			return EXIT_TRANSLATION_FAILED;
		}
		return EXIT_OK;
	}

	private static void writeProgram(C2CfaOptions opts, Program program) throws IOException {
		if (opts.output != null) {
			logger.info("Writing translation to \"" + opts.output + "\"");
			try (BufferedWriter writer = Files.newBufferedWriter(Paths.get(opts.output), StandardCharsets.UTF_8)) {
				writeProgram(opts.format, program, writer);
			}
		} else {
			Writer writer = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
			writeProgram(opts.format, program, writer);
			writer.flush();
		}
	}

	static void writeProgram(String format, Program program, Writer writer) throws IOException {
		if (format.equals(C2CfaOptions.FORMAT_JSON)) {
			ProgramJsonWriter.write(program, writer);
		} else {
			IndentingWriter out = new IndentingWriter(writer);
			new ProgramFormattingVisitor(out).visit(program);
			out.flush();
		}
	}
}
