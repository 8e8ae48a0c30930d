package c2cfa.trans.passes.preprocess;

import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs an external preprocessor that reads the source from stdin and writes
 * the result to stdout.
 */
public class ExternalCPreprocessor implements CPreprocessor {

	public static final List<String> DEFAULT_COMMAND = Collections.unmodifiableList(Arrays.asList("cpp", "-x", "c", "-"));

	private static final Logger logger = Logger.getLogger("ExternalCPreprocessor");

	private final List<String> command;

	public ExternalCPreprocessor() {
		this(DEFAULT_COMMAND);
	}

	public ExternalCPreprocessor(List<String> command) {
		if (command.isEmpty()) {
			throw new IllegalArgumentException("preprocessor command must not be empty");
		}
		this.command = Collections.unmodifiableList(new ArrayList<>(command));
	}

	public List<String> getCommand() {
		return command;
	}

	private Process start(ProcessBuilder builder) throws PreprocessingIssue {
		try {
			return builder.start();
		} catch (IOException e) {
			throw new PreprocessingIssue(command, "could not start preprocessor: " + e.getMessage(), null, e);
		}
	}

	@Override
	public String preprocess(Path file, String source) throws PreprocessingIssue {
		logger.fine("running " + String.join(" ", command) + " on " + file);
		ProcessBuilder builder = new ProcessBuilder(command);
		// stderr is merged so diagnostics end up in the issue
		builder.redirectErrorStream(true);
		Process process = start(builder);
		// stdin is fed from a separate thread so a full stdout pipe cannot block us
		IOException[] writeFailure = new IOException[1];
		Thread feeder = new Thread(() -> {
			try (OutputStream stdin = process.getOutputStream()) {
				IOUtils.write(source, stdin, StandardCharsets.UTF_8);
			} catch (IOException e) {
				writeFailure[0] = e;
			}
		}, "preprocessor-stdin");
		feeder.start();
		try {
			String output;
			try (InputStream stdout = process.getInputStream()) {
				output = IOUtils.toString(stdout, StandardCharsets.UTF_8);
			}
			int exitCode = process.waitFor();
			feeder.join();
			if (exitCode != 0) {
				throw new PreprocessingIssue(command, "preprocessor exited with status " + exitCode, output, null);
			}
			if (writeFailure[0] != null) {
				throw new PreprocessingIssue(command, "could not send the source to the preprocessor: "
						+ writeFailure[0].getMessage(), output, writeFailure[0]);
			}
			return output;
		} catch (IOException e) {
			process.destroy();
			awaitFeeder(feeder);
			throw new PreprocessingIssue(command, "I/O error while preprocessing: " + e.getMessage(), null, e);
		} catch (InterruptedException e) {
			process.destroy();
			awaitFeeder(feeder);
			Thread.currentThread().interrupt();
			throw new PreprocessingIssue(command, "interrupted while waiting for the preprocessor", null, e);
		}
	}

	/**
	 * Waits for the stdin thread of a destroyed process; its pipe is closed, so
	 * the thread ends shortly. An interrupt during the wait is kept for the caller.
	 */
	private static void awaitFeeder(Thread feeder) {
		boolean interrupted = false;
		while (feeder.isAlive()) {
			try {
				feeder.join();
			} catch (InterruptedException e) {
				interrupted = true;
			}
		}
		if (interrupted) {
			Thread.currentThread().interrupt();
		}
	}

}
