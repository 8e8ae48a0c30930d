package c2cfa.util;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A position in a C source file. Lines and columns are 1-based; after
 * preprocessing the line is the one reported by the last cpp line marker, so it
 * refers to the file the user wrote rather than the expanded text.
 */
public class SourceLocation {
	private final Path file;
	private final int line;
	private final int column;

	public SourceLocation(Path file, int line, int column) {
		this.file = file;
		this.line = line;
		this.column = column;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1);
	}

	public boolean isUnknown() {
		return line < 0;
	}

	public String prettyString() {
		if(isUnknown()) {
			return "at unknown source location";
		}
		String where = "at " + line + ":" + column;
		if(file != null) {
			where += " in file " + file;
		}
		return where;
	}

	public Path getFile() {
		return file;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, line, column);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return line == other.line && column == other.column && Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		}
		return "SourceLocation [file=" + file + ", line=" + line + ", column=" + column + "]";
	}

}
