package c2cfa.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that prefixes every line with the current indentation. The prefix is
 * written lazily, when the first character of a line arrives, so that an
 * indentation opened after a line break still applies to that line.
 */
public class IndentingWriter extends Writer {

	private static final int STEP = 4;

	private final Writer out;
	private int depth;
	private boolean atLineStart;

	/**
	 * An open indentation level, released by {@link #close()} so it can be used
	 * in a try-with-resources block.
	 */
	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private boolean closed;

		private Indent(IndentingWriter writer) {
			this.writer = writer;
			this.closed = false;
		}

		@Override
		public void close() {
			if (!closed) {
				closed = true;
				writer.depth--;
			}
		}

	}

	public IndentingWriter(Writer out) {
		this.out = out;
		this.depth = 0;
		this.atLineStart = false;
	}

	public Indent indent() {
		depth++;
		return new Indent(this);
	}

	public void newLine() throws IOException {
		write(System.lineSeparator());
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		int end = offset + len;
		int runStart = offset;
		for (int i = offset; i < end; ++i) {
			if (atLineStart) {
				writePrefix();
				atLineStart = false;
			}
			if (chars[i] == '\n') {
				out.write(chars, runStart, i + 1 - runStart);
				runStart = i + 1;
				atLineStart = true;
			}
		}
		if (runStart < end) {
			out.write(chars, runStart, end - runStart);
		}
	}

	private void writePrefix() throws IOException {
		for (int i = 0; i < depth * STEP; ++i) {
			out.write(' ');
		}
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

}
