package c2cfa;

/**
 * Thrown when the translator's own invariants are broken, as opposed to problems
 * with the input, which are reported as issues.
 */
public class InternalCompilerError extends RuntimeException {

	public InternalCompilerError(String detail) {
		super("internal compiler error: " + detail);
	}

}
