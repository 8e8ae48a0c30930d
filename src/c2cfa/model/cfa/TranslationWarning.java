package c2cfa.model.cfa;

import java.util.Objects;

/**
 * A non-fatal problem: the construct was translated to a degraded model or
 * dropped.
 */
public class TranslationWarning {

	private final String message;
	private final int line;

	public TranslationWarning(String message, int line) {
		this.message = message;
		this.line = line;
	}

	public String getMessage() {
		return message;
	}

	public int getLine() {
		return line;
	}

	@Override
	public int hashCode() {
		return Objects.hash(message, line);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		TranslationWarning other = (TranslationWarning) obj;
		return line == other.line && Objects.equals(message, other.message);
	}

	@Override
	public String toString() {
		return "line " + line + ": " + message;
	}

}
